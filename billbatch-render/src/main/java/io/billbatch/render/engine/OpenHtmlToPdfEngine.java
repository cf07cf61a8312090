package io.billbatch.render.engine;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import io.billbatch.render.OutputFormat;
import io.billbatch.render.RenderException;
import io.billbatch.render.RenderRequest;
import io.billbatch.render.RenderingEngine;
import org.jsoup.helper.W3CDom;
import org.jsoup.nodes.Document;

import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * In-process CSS layout renderer on top of PDFBox. The HTML is parsed by jsoup and handed over
 * as a DOM, so ordinary HTML5 works; layout covers the CSS 2.1 paged-media subset only, but
 * there is no external dependency, so it is the last resort.
 */
public class OpenHtmlToPdfEngine implements RenderingEngine {

    public static final String NAME = "openhtmltopdf";

    private final String baseUri;

    public OpenHtmlToPdfEngine() {
        this(Path.of("").toAbsolutePath().toUri().toString());
    }

    /**
     * @param baseUri base for resolving relative resource links
     */
    public OpenHtmlToPdfEngine(String baseUri) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean probe() {
        return true;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return Set.of(OutputFormat.PDF);
    }

    @Override
    public byte[] render(RenderRequest request) throws RenderException {
        if (request.format() != OutputFormat.PDF) {
            throw new RenderException(NAME + " does not support " + request.format());
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.useFastMode();
            Document doc = HtmlPageStyles.styled(request.html(), request.options());
            builder.withW3cDocument(new W3CDom().fromJsoup(doc), baseUri);
            builder.toStream(out);
            builder.run();
            return out.toByteArray();
        } catch (Exception e) {
            throw new RenderException(NAME + " failed for " + request.sourceName() + ": " + e.getMessage(), e);
        }
    }
}
