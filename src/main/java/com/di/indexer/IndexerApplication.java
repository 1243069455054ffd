package com.di.indexer;

import com.di.indexer.config.IndexerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
public class IndexerApplication {

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(IndexerApplication.class);
		app.addListeners(new StatsModeListener());

		ConfigurableApplicationContext ctx;
		try {
			ctx = app.run(args);
		} catch (RuntimeException e) {
			log.error("[STARTUP] indexer failed to start: {}", e.getMessage());
			System.exit(1);
			return;
		}
		if (ctx.getBean(IndexerProperties.class).isStatsMode()) {
			System.exit(SpringApplication.exit(ctx));
		}
	}

	/** {@code indexer.mode=stats} is a one-shot command: no web server. */
	static class StatsModeListener implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

		@Override
		public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
			String mode = event.getEnvironment().getProperty("indexer.mode", "run");
			if ("stats".equalsIgnoreCase(mode.trim())) {
				event.getSpringApplication().setWebApplicationType(WebApplicationType.NONE);
			}
		}
	}
}
