package org.orchestration.migrator.analyzerConfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.orchestration.migrator.analyzerConfig.models.AnalyzerConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

public class AnalyzerConfigHelper {
    public static final String SCHEMA_RESOURCE = "analyzerConfig/analyzer-config.schema.json";
    public static final String DEFAULT_CONFIG_RESOURCE = "analyzerConfig/default-config.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads and validates an analyzer config file.
     *
     * @param configFilePath path of the JSON config
     * @return the bound config
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the file does not match the config schema
     */
    public static AnalyzerConfig loadConfigFile(String configFilePath) throws IOException {
        JsonNode configNode = mapper.readTree(new File(configFilePath));
        return bind(configNode, configFilePath);
    }

    /**
     * Loads the config shipped on the classpath.
     */
    public static AnalyzerConfig loadDefaultConfig() throws IOException {
        ClassLoader cl = AnalyzerConfigHelper.class.getClassLoader();
        try (InputStream configStream = cl.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (configStream == null) {
                throw new IllegalArgumentException("Default config not found: " + DEFAULT_CONFIG_RESOURCE);
            }
            return bind(mapper.readTree(configStream), DEFAULT_CONFIG_RESOURCE);
        }
    }

    /**
     * Validates a config document against the config schema.
     *
     * @param configNode the parsed config
     * @return the validation messages, empty when valid
     */
    public static Set<ValidationMessage> validate(JsonNode configNode) throws IOException {
        ClassLoader cl = AnalyzerConfigHelper.class.getClassLoader();
        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalArgumentException("Schema not found: " + SCHEMA_RESOURCE);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(configNode);
        }
    }

    private static AnalyzerConfig bind(JsonNode configNode, String source) throws IOException {
        Set<ValidationMessage> errors = validate(configNode);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Analyzer config " + source + " is INVALID: " + errors);
        }
        return mapper.treeToValue(configNode, AnalyzerConfig.class);
    }
}
