package io.billbatch.render;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineSelectorTest {

    private static final RenderRequest INVOICE = RenderRequest.pdf("invoice-1", "<p>bill</p>");

    @Test
    void shouldFallBackToFirstWorkingEngineEveryTime() {
        StubEngine a = StubEngine.failing("a", "boom");
        StubEngine b = new StubEngine("b");
        StubEngine c = new StubEngine("c");
        EngineSelector selector = new EngineSelector(List.of(a, b, c));

        for (int i = 0; i < 3; i++) {
            RenderResult result = selector.render(INVOICE);

            assertThat(result.success()).isTrue();
            assertThat(result.engineUsed()).isEqualTo("b");
            assertThat(new String(result.output(), StandardCharsets.UTF_8)).isEqualTo("b:invoice-1");
            assertThat(result.errors()).containsExactly("a: boom");
        }
        assertThat(c.renderCalls).hasValue(0);
    }

    @Test
    void exhaustionShouldReportOneErrorPerEngineInPriorityOrder() {
        StubEngine a = StubEngine.failing("a", "first");
        StubEngine b = new StubEngine("b");
        b.available = false;
        StubEngine c = new StubEngine("c");
        c.crash = new IllegalStateException("third");
        EngineSelector selector = new EngineSelector(List.of(a, b, c));

        RenderResult result = selector.render(INVOICE);

        assertThat(result.success()).isFalse();
        assertThat(result.output()).isNull();
        assertThat(result.engineUsed()).isNull();
        assertThat(result.errors()).containsExactly("a: first", "b: engine unavailable", "c: third");
        assertThat(b.renderCalls).hasValue(0);
    }

    @Test
    void unsupportedFormatShouldBeSkipped() {
        StubEngine pdfOnly = new StubEngine("pdf-only", Set.of(OutputFormat.PDF));
        StubEngine both = new StubEngine("both");
        EngineSelector selector = new EngineSelector(List.of(pdfOnly, both));

        RenderResult result = selector.render(new RenderRequest("shot", "<p/>", OutputFormat.PNG, null));

        assertThat(result.engineUsed()).isEqualTo("both");
        assertThat(result.errors()).containsExactly("pdf-only: does not support PNG");
        assertThat(pdfOnly.renderCalls).hasValue(0);
    }

    @Test
    void probeResultShouldBeCachedForTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        StubEngine a = new StubEngine("a");
        EngineSelector selector = new EngineSelector(List.of(a), Duration.ofMinutes(5), clock);

        selector.render(INVOICE);
        selector.render(INVOICE);
        assertThat(a.probeCalls).hasValue(1);

        clock.advance(Duration.ofMinutes(6));
        selector.render(INVOICE);
        assertThat(a.probeCalls).hasValue(2);
    }

    @Test
    void zeroTtlShouldProbeEveryCall() {
        StubEngine a = new StubEngine("a");
        EngineSelector selector = new EngineSelector(List.of(a), Duration.ZERO, Clock.systemUTC());

        selector.render(INVOICE);
        selector.render(INVOICE);

        assertThat(a.probeCalls).hasValue(2);
    }

    @Test
    void engineUnavailableDuringRenderShouldMarkItUnavailable() {
        StubEngine a = new StubEngine("a");
        a.failure = new EngineUnavailableException("gone");
        StubEngine b = new StubEngine("b");
        EngineSelector selector = new EngineSelector(List.of(a, b));

        selector.render(INVOICE);
        RenderResult second = selector.render(INVOICE);

        assertThat(second.errors()).containsExactly("a: engine unavailable");
        assertThat(a.renderCalls).hasValue(1);
        assertThat(selector.describeEngines().get(0).available()).isFalse();
    }

    @Test
    void describeEnginesShouldKeepConstructionOrder() {
        StubEngine a = new StubEngine("a");
        StubEngine b = new StubEngine("b");
        b.available = false;
        EngineSelector selector = new EngineSelector(List.of(a, b));

        assertThat(selector.describeEngines()).extracting(EngineDescriptor::available).containsExactly(null, null);

        List<EngineDescriptor> refreshed = selector.refreshAvailability();

        assertThat(refreshed).extracting(EngineDescriptor::name).containsExactly("a", "b");
        assertThat(refreshed).extracting(EngineDescriptor::priorityRank).containsExactly(0, 1);
        assertThat(refreshed).extracting(EngineDescriptor::available).containsExactly(true, false);
        assertThat(selector.engineNames()).containsExactly("a", "b");
    }

    @Test
    void constructorShouldRejectEmptyAndDuplicateEngines() {
        assertThatThrownBy(() -> new EngineSelector(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EngineSelector(List.of(new StubEngine("a"), new StubEngine("a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
