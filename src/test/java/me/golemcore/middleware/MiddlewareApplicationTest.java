package me.golemcore.middleware;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class MiddlewareApplicationTest {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(MiddlewareApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(MiddlewareApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(MiddlewareApplication.class.getMethod("main", String[].class));
    }
}
