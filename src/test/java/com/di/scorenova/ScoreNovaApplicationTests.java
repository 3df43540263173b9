package com.di.scorenova;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for ScoreNovaApplication. Loading the full context would start the
 * scheduler threads, so this only checks the entry point.
 */
@DisplayName("ScoreNovaApplication Tests")
class ScoreNovaApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = ScoreNovaApplication.class;
		assertNotNull(mainClass);
		assertEquals("ScoreNovaApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = ScoreNovaApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should scan configuration properties")
	void testConfigurationPropertiesScan() {
		assertTrue(ScoreNovaApplication.class.isAnnotationPresent(
				org.springframework.boot.context.properties.ConfigurationPropertiesScan.class));
	}
}
