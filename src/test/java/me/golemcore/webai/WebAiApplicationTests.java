package me.golemcore.webai;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class WebAiApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(WebAiApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(WebAiApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(WebAiApplication.class.getMethod("main", String[].class));
    }
}
