package com.vidnyan.ust.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings under the {@code ust} prefix.
 */
@Data
@Component
@ConfigurationProperties(prefix = "ust")
public class UstProperties {

    private Java java = new Java();

    private Parse parse = new Parse();

    @Data
    public static class Java {
        /**
         * JavaParser language level, e.g. JAVA_17.
         */
        private String languageLevel = "JAVA_17";
    }

    /**
     * One-shot CLI parse. Nothing runs while {@code path} is blank.
     */
    @Data
    public static class Parse {
        private String path = "";
        private String language = "";
        private String analysis = "all";
        private boolean printTree = false;
    }
}
