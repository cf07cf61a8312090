package io.billbatch.render.engine;

import io.billbatch.render.RenderOptions;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Injects page setup CSS into an HTML document so every engine lays out the same page:
 * {@code @page} size/orientation/margins, content zoom, and fixed table layout so wide
 * tables wrap instead of being shrunk.
 */
public final class HtmlPageStyles {

    private HtmlPageStyles() {
    }

    public static String css(RenderOptions options) {
        StringBuilder css = new StringBuilder();
        css.append("@page { size: ").append(options.pageSize().cssName()).append(' ')
                .append(options.orientation().cssName())
                .append("; margin: ").append(options.marginCss()).append("; }\n");
        if (options.zoom() != 1.0) {
            css.append("body { zoom: ").append(formatZoom(options.zoom())).append("; }\n");
        }
        css.append("table { table-layout: fixed; width: 100%; }\n");
        css.append("body { -webkit-print-color-adjust: exact; print-color-adjust: exact; }\n");
        return css.toString();
    }

    /**
     * Parse the document leniently and append the page style to its head. Fragments and
     * documents without a head come back as complete UTF-8 documents.
     */
    public static Document styled(String html, RenderOptions options) {
        Document doc = Jsoup.parse(html);
        doc.charset(StandardCharsets.UTF_8);
        if (doc.documentType() == null) {
            doc.prependChild(new DocumentType("html", "", ""));
        }
        doc.head().appendElement("style")
                .attr("type", "text/css")
                .appendChild(new DataNode(css(options)));
        return doc;
    }

    /**
     * Serialized form of {@link #styled}, for engines that load the document from text.
     */
    public static String apply(String html, RenderOptions options) {
        return styled(html, options).outerHtml();
    }

    static String formatZoom(double zoom) {
        return BigDecimal.valueOf(zoom).stripTrailingZeros().toPlainString().toLowerCase(Locale.ROOT);
    }
}
