package io.billbatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.billbatch.JobRegistry;
import io.billbatch.NamedBatchProcessor;
import io.billbatch.core.ProcessorRegistry;
import io.billbatch.internal.json.JobReportWriter;
import io.billbatch.internal.json.SubmissionRequestReader;
import io.billbatch.internal.memory.InMemoryJobRegistry;
import io.billbatch.render.EngineSelector;
import io.billbatch.render.RenderingEngine;
import io.billbatch.render.RenderingProcessor;
import io.billbatch.render.engine.ChromeHeadlessEngine;
import io.billbatch.render.engine.OpenHtmlToPdfEngine;
import io.billbatch.render.engine.PlaywrightEngine;
import io.billbatch.render.engine.WkhtmltopdfEngine;
import io.billbatch.resource.MxBeanResourceSampler;
import io.billbatch.resource.ResourceMonitor;
import io.billbatch.resource.ThresholdResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot auto-configuration entrypoint for the batch registry and rendering engines.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass(JobRegistry.class)
@EnableConfigurationProperties(BatchProperties.class)
@ConditionalOnProperty(prefix = "billbatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BillBatchConfig {
    private static final Logger log = LoggerFactory.getLogger(BillBatchConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper billBatchObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceMonitor resourceMonitor(BatchProperties props) {
        if (!props.isResourceCheckEnabled()) {
            return ResourceMonitor.alwaysAllow();
        }
        return new ThresholdResourceMonitor(new MxBeanResourceSampler(), props.getMaxMemoryPercent(), props.getMaxCpuPercent());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChromeHeadlessEngine chromeHeadlessEngine(BatchProperties props) {
        BatchProperties.Render render = props.getRender();
        return new ChromeHeadlessEngine(render.getChromeExecutables(), render.getProcessTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public WkhtmltopdfEngine wkhtmltopdfEngine(BatchProperties props) {
        BatchProperties.Render render = props.getRender();
        return new WkhtmltopdfEngine(render.getWkhtmltopdfExecutable(), render.getProcessTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public PlaywrightEngine playwrightEngine() {
        return new PlaywrightEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenHtmlToPdfEngine openHtmlToPdfEngine() {
        return new OpenHtmlToPdfEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineSelector engineSelector(BatchProperties props, ObjectProvider<List<RenderingEngine>> enginesProvider) {
        List<RenderingEngine> ordered = orderEngines(props.getRender().getEngines(), enginesProvider.getIfAvailable(List::of));
        return new EngineSelector(ordered, props.getRender().getProbeTtl(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public RenderingProcessor renderingProcessor(EngineSelector engineSelector) {
        return new RenderingProcessor(engineSelector);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessorRegistry processorRegistry(ObjectProvider<List<NamedBatchProcessor<?, ?>>> processorsProvider) {
        List<NamedBatchProcessor<?, ?>> processors = processorsProvider.getIfAvailable(List::of);
        return new ProcessorRegistry(processors);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(BatchProperties props, ProcessorRegistry processors, ResourceMonitor resourceMonitor, ObjectMapper om) {
        return new InMemoryJobRegistry(props, processors, resourceMonitor, om);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubmissionRequestReader submissionRequestReader(BatchProperties props, ObjectMapper om) {
        return new SubmissionRequestReader(om, props.defaultBatchConfig());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobReportWriter jobReportWriter(ObjectMapper om) {
        return new JobReportWriter(om);
    }

    @Bean
    @ConditionalOnMissingBean
    public BillBatchLifecycle billBatchLifecycle(JobRegistry jobRegistry) {
        return new BillBatchLifecycle(jobRegistry);
    }

    /**
     * Keep only the engines named in {@code billbatch.render.engines}, in that order.
     */
    static List<RenderingEngine> orderEngines(List<String> names, List<RenderingEngine> available) {
        Map<String, RenderingEngine> byName = new LinkedHashMap<>();
        for (RenderingEngine engine : available) {
            byName.putIfAbsent(engine.name(), engine);
        }
        List<RenderingEngine> ordered = new ArrayList<>();
        for (String name : names) {
            RenderingEngine engine = byName.get(name);
            if (engine == null) {
                log.warn("Unknown rendering engine '{}' in billbatch.render.engines, known={}", name, byName.keySet());
                continue;
            }
            if (!ordered.contains(engine)) {
                ordered.add(engine);
            }
        }
        if (ordered.isEmpty()) {
            throw new IllegalStateException("billbatch.render.engines selects no known engine, known=" + byName.keySet());
        }
        return ordered;
    }
}
