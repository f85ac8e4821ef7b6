package org.crmjobs.config;

import org.crmjobs.config.utils.XmlUtil;
import org.crmjobs.utils.security.KeyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_DB_PASSWORD = "CRM_DB_PASSWORD";

    private ConfigLoader() {}

    /**
     * Loads the XML configuration from the file system, falling back to the classpath,
     * and applies secret overrides from the environment.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        try (InputStream in = open(xmlPath)) {
            Document doc = XmlUtil.parse(in);
            XmlConfiguration cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
            applyOverrides(cfg);
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file " + xmlPath + ": " + e.getMessage(), e);
        }
    }

    private static InputStream open(String xmlPath) throws Exception {
        Path path = Path.of(xmlPath);
        if (Files.isRegularFile(path)) {
            logger.debug("Reading configuration from file {}", path.toAbsolutePath());
            return Files.newInputStream(path);
        }
        InputStream resource = ConfigLoader.class.getClassLoader().getResourceAsStream(xmlPath);
        if (resource == null) {
            throw new FileNotFoundException("Configuration not found on disk or classpath: " + xmlPath);
        }
        logger.debug("Reading configuration from classpath resource {}", xmlPath);
        return resource;
    }

    private static void applyOverrides(XmlConfiguration cfg) {
        String dbPassword = KeyProvider.find(ENV_DB_PASSWORD);
        if (dbPassword != null && cfg.dataSource != null) {
            cfg.dataSource.password = dbPassword;
            logger.debug("Database password taken from {}", ENV_DB_PASSWORD);
        }
    }
}
