package com.di.indexer;

import com.di.indexer.config.IndexerProperties;
import com.di.indexer.ingest.IngestionLoop;
import com.di.indexer.stats.StatsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context smoke test in stats mode against an in-memory database.
 */
@SpringBootTest(
		webEnvironment = SpringBootTest.WebEnvironment.NONE,
		properties = {
				"spring.datasource.url=jdbc:h2:mem:smoke;DB_CLOSE_DELAY=-1",
				"spring.datasource.username=sa",
				"spring.datasource.password=",
				"indexer.mode=stats",
				"indexer.verify-on-startup=false"
		})
@DisplayName("IndexerApplication Tests")
class IndexerApplicationTests {

	@Autowired
	private ApplicationContext ctx;

	@Test
	@DisplayName("Should start the context with the schema applied")
	void testContextLoads() {
		assertTrue(ctx.getBean(IndexerProperties.class).isStatsMode());
		assertEquals(0, ctx.getBean(StatsService.class).stats().getTotalSubmissions());
	}

	@Test
	@DisplayName("Ingestion loop does not auto-start in stats mode")
	void testLoopIdleInStatsMode() {
		IngestionLoop loop = ctx.getBean(IngestionLoop.class);
		assertFalse(loop.isAutoStartup());
		assertFalse(loop.isRunning());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = IndexerApplication.class.getMethod("main", String[].class);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
