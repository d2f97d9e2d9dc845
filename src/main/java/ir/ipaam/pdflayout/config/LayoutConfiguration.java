package ir.ipaam.pdflayout.config;

import ir.ipaam.pdflayout.domain.font.DirectoryFontBackend;
import ir.ipaam.pdflayout.domain.font.FontBackend;
import ir.ipaam.pdflayout.domain.font.Standard14FontBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(LayoutProperties.class)
public class LayoutConfiguration {

    @Bean
    public FontBackend fontBackend(LayoutProperties properties) {
        Standard14FontBackend builtin = new Standard14FontBackend();
        if (properties.getFontDirectory() == null) {
            log.info("Using built-in PDF fonts");
            return builtin;
        }
        log.info("Loading fonts from {}", properties.getFontDirectory());
        return new DirectoryFontBackend(properties.getFontDirectory(), builtin, properties.getFontFamily());
    }
}
