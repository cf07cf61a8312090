package io.billbatch.render.engine;

import io.billbatch.render.Orientation;
import io.billbatch.render.OutputFormat;
import io.billbatch.render.RenderOptions;
import io.billbatch.render.RenderRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class WkhtmltopdfEngine extends CommandLineEngine {

    public static final String NAME = "wkhtmltopdf";

    public WkhtmltopdfEngine() {
        this("wkhtmltopdf", Duration.ofSeconds(60));
    }

    public WkhtmltopdfEngine(String executable, Duration processTimeout) {
        super(NAME, List.of(executable), processTimeout);
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return Set.of(OutputFormat.PDF);
    }

    @Override
    protected List<String> buildCommand(String executable, Path input, Path output, RenderRequest request) {
        RenderOptions o = request.options();
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.add("--page-size");
        cmd.add(o.pageSize().cssName());
        cmd.add("--orientation");
        cmd.add(o.orientation() == Orientation.LANDSCAPE ? "Landscape" : "Portrait");
        cmd.add("--margin-top");
        cmd.add(o.marginTop());
        cmd.add("--margin-right");
        cmd.add(o.marginRight());
        cmd.add("--margin-bottom");
        cmd.add(o.marginBottom());
        cmd.add("--margin-left");
        cmd.add(o.marginLeft());
        cmd.add("--dpi");
        cmd.add(String.valueOf(o.dpi()));
        cmd.add("--zoom");
        cmd.add(HtmlPageStyles.formatZoom(o.zoom()));
        cmd.add("--encoding");
        cmd.add("UTF-8");
        cmd.add("--enable-local-file-access");
        cmd.add("--print-media-type");
        cmd.add("--disable-smart-shrinking");
        cmd.add("--quiet");
        cmd.add(input.toAbsolutePath().toString());
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }
}
