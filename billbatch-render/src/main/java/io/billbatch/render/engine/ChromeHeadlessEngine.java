package io.billbatch.render.engine;

import io.billbatch.render.OutputFormat;
import io.billbatch.render.RenderOptions;
import io.billbatch.render.RenderRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Chrome/Chromium in headless mode: {@code --print-to-pdf} for PDF, {@code --screenshot} for PNG.
 */
public class ChromeHeadlessEngine extends CommandLineEngine {

    public static final String NAME = "chrome-headless";
    public static final List<String> DEFAULT_EXECUTABLES = List.of("google-chrome", "chrome", "chromium", "chromium-browser");

    public ChromeHeadlessEngine() {
        this(DEFAULT_EXECUTABLES, Duration.ofSeconds(60));
    }

    public ChromeHeadlessEngine(List<String> executables, Duration processTimeout) {
        super(NAME, executables, processTimeout);
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return Set.of(OutputFormat.PDF, OutputFormat.PNG);
    }

    @Override
    protected List<String> buildCommand(String executable, Path input, Path output, RenderRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.add("--headless");
        cmd.add("--disable-gpu");
        cmd.add("--no-sandbox");
        cmd.add("--run-all-compositor-stages-before-draw");
        cmd.add("--disable-smart-shrinking");
        if (request.format() == OutputFormat.PNG) {
            RenderOptions o = request.options();
            cmd.add("--hide-scrollbars");
            cmd.add("--window-size=" + toPixels(o.pageSize().widthMm(o.orientation()), o.dpi())
                    + "," + toPixels(o.pageSize().heightMm(o.orientation()), o.dpi()));
            cmd.add("--screenshot=" + output.toAbsolutePath());
        } else {
            cmd.add("--no-margins");
            cmd.add("--no-pdf-header-footer");
            cmd.add("--print-to-pdf=" + output.toAbsolutePath());
        }
        cmd.add(input.toAbsolutePath().toUri().toString());
        return cmd;
    }

    static int toPixels(int millimetres, int dpi) {
        return (int) Math.round(millimetres / 25.4 * dpi);
    }
}
