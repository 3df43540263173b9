package com.di.scorenova.source;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * scorenova:
 *   source:
 *     type: synthetic        # synthetic | json-file
 *     synthetic-count: 1000
 *     seed:                  # optional, fixes the generated values
 *     path: /data/batch.json # json-file only
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.source")
public class RecordSourceProperties {

    private String type = "synthetic";

    private int syntheticCount = 1000;

    private Long seed;

    private String path;
}
