package com.simrelay.core.schema;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "simrelay.schema")
public class SchemaProperties {

    /** Spring resource location of the variable schema. */
    private String location = "classpath:schema/variables.json";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
