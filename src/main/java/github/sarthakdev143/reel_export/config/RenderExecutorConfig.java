package github.sarthakdev143.reel_export.config;

import github.sarthakdev143.reel_export.compiler.RetimeGraphBuilder;
import github.sarthakdev143.reel_export.compiler.TimelineCompiler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Worker pool for encoder jobs, the scheduler that drives progress streams, and the graph compilers.
 */
@Configuration
@EnableConfigurationProperties(ReelExportProperties.class)
public class RenderExecutorConfig {

    @Bean(name = "renderTaskExecutor")
    public ThreadPoolTaskExecutor renderTaskExecutor(ReelExportProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getWorkerThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("render-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "progressTaskScheduler")
    public ThreadPoolTaskScheduler progressTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("progress-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public TimelineCompiler timelineCompiler(ReelExportProperties properties) {
        return new TimelineCompiler(properties.getAudioMixDuration());
    }

    @Bean
    public RetimeGraphBuilder retimeGraphBuilder() {
        return new RetimeGraphBuilder();
    }
}
