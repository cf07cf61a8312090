package io.billbatch.render.engine;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Margin;
import io.billbatch.render.EngineUnavailableException;
import io.billbatch.render.Orientation;
import io.billbatch.render.OutputFormat;
import io.billbatch.render.RenderException;
import io.billbatch.render.RenderOptions;
import io.billbatch.render.RenderRequest;
import io.billbatch.render.RenderingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Chromium driven through Playwright. The browser is launched lazily on first use and shared;
 * Playwright objects are not thread-safe, so renders are serialized.
 */
public class PlaywrightEngine implements RenderingEngine, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightEngine.class);

    public static final String NAME = "playwright";

    private final Object lock = new Object();
    private final Supplier<Playwright> playwrightFactory;
    private Playwright playwright;
    private Browser browser;

    public PlaywrightEngine() {
        this(Playwright::create);
    }

    PlaywrightEngine(Supplier<Playwright> playwrightFactory) {
        this.playwrightFactory = Objects.requireNonNull(playwrightFactory, "playwrightFactory must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<OutputFormat> supportedFormats() {
        return Set.of(OutputFormat.PDF, OutputFormat.PNG);
    }

    @Override
    public boolean probe() {
        synchronized (lock) {
            try {
                browser();
                return true;
            } catch (RuntimeException e) {
                log.debug("Playwright probe failed msg={}", e.getMessage());
                return false;
            }
        }
    }

    @Override
    public byte[] render(RenderRequest request) throws RenderException {
        synchronized (lock) {
            Browser b;
            try {
                b = browser();
            } catch (RuntimeException e) {
                throw new EngineUnavailableException("failed to launch Chromium: " + e.getMessage(), e);
            }

            RenderOptions o = request.options();
            try (BrowserContext context = b.newContext(); Page page = context.newPage()) {
                page.setContent(HtmlPageStyles.apply(request.html(), o));
                if (request.format() == OutputFormat.PNG) {
                    page.setViewportSize(
                            ChromeHeadlessEngine.toPixels(o.pageSize().widthMm(o.orientation()), o.dpi()),
                            ChromeHeadlessEngine.toPixels(o.pageSize().heightMm(o.orientation()), o.dpi()));
                    return page.screenshot(new Page.ScreenshotOptions().setFullPage(true));
                }
                return page.pdf(new Page.PdfOptions()
                        .setFormat(o.pageSize().cssName())
                        .setLandscape(o.orientation() == Orientation.LANDSCAPE)
                        .setMargin(new Margin()
                                .setTop(o.marginTop())
                                .setRight(o.marginRight())
                                .setBottom(o.marginBottom())
                                .setLeft(o.marginLeft()))
                        .setPrintBackground(true)
                        .setPreferCSSPageSize(true));
            } catch (PlaywrightException e) {
                throw new RenderException("playwright render failed for " + request.sourceName() + ": " + e.getMessage(), e);
            }
        }
    }

    private Browser browser() {
        if (browser == null || !browser.isConnected()) {
            if (playwright == null) {
                playwright = playwrightFactory.get();
            }
            browser = playwright.chromium().launch();
            log.info("Playwright Chromium launched version={}", browser.version());
        }
        return browser;
    }

    @Override
    public void close() {
        synchronized (lock) {
            try {
                if (browser != null) {
                    browser.close();
                }
                if (playwright != null) {
                    playwright.close();
                }
            } catch (PlaywrightException e) {
                log.warn("Failed to close Playwright msg={}", e.getMessage());
            } finally {
                browser = null;
                playwright = null;
            }
        }
    }
}
