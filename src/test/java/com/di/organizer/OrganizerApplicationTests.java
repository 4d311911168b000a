package com.di.organizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for OrganizerApplication. Store, API and controller behaviour are covered by
 * their own tests without a Spring context.
 */
@DisplayName("OrganizerApplication Tests")
class OrganizerApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = OrganizerApplication.class;
		assertNotNull(mainClass);
		assertEquals("OrganizerApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = OrganizerApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
