package io.billbatch.render.engine;

import io.billbatch.render.OutputFormat;
import io.billbatch.render.RenderException;
import io.billbatch.render.RenderRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenHtmlToPdfEngineTest {

    private final OpenHtmlToPdfEngine engine = new OpenHtmlToPdfEngine();

    @Test
    void shouldRenderWellFormedDocumentToPdf() throws Exception {
        String html = "<html><head><title>Bill 42</title></head>"
                + "<body><h1>Bill 42</h1><table><tr><td>Concrete</td><td>1200.00</td></tr></table></body></html>";

        byte[] pdf = engine.render(RenderRequest.pdf("bill-42", html));

        assertThat(engine.probe()).isTrue();
        assertThat(pdf.length).isGreaterThan(100);
        assertThat(new String(pdf, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
    }

    @Test
    void shouldRenderFragment() throws Exception {
        byte[] pdf = engine.render(RenderRequest.pdf("fragment", "<p>total: 42</p>"));

        assertThat(new String(pdf, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
    }

    @Test
    void shouldRenderHtmlThatIsNotXhtml() throws Exception {
        byte[] fragment = engine.render(RenderRequest.pdf("bill", "<p>Bill 42<br>Total&nbsp;1200</p>"));
        byte[] document = engine.render(RenderRequest.pdf("bill-doc",
                "<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Bill</title></head>"
                        + "<body><p>Line<br>Total&nbsp;1200</body></html>"));

        assertThat(new String(fragment, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
        assertThat(new String(document, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("%PDF");
    }

    @Test
    void shouldRejectPng() {
        assertThat(engine.supportedFormats()).containsExactly(OutputFormat.PDF);
        assertThatThrownBy(() -> engine.render(new RenderRequest("x", "<p/>", OutputFormat.PNG, null)))
                .isInstanceOf(RenderException.class);
    }
}
