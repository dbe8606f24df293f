package com.rainmaker.schema.codegen.project;

import lombok.Builder;
import lombok.Value;

/**
 * Datasource and client generator blocks placed before the compiled models.
 */
@Value
@Builder
public class DocumentHeader {

    @Builder.Default
    String provider = "postgresql";

    /**
     * Environment variable holding the connection string.
     */
    @Builder.Default
    String databaseUrlEnv = "DATABASE_URL";

    @Builder.Default
    String clientGenerator = "prisma-client-js";

    public static DocumentHeader defaults() {
        return DocumentHeader.builder().build();
    }
}
