package com.poc.upgrade.infrastructure.database;

import lombok.Builder;
import lombok.Value;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Product information reported by a live connection.
 */
@Value
@Builder
public class ConnectionMetadata {
    String productName;
    String productVersion;
    int majorVersion;
    String url;

    public static ConnectionMetadata from(DatabaseMetaData metaData) throws SQLException {
        return ConnectionMetadata.builder()
            .productName(metaData.getDatabaseProductName())
            .productVersion(metaData.getDatabaseProductVersion())
            .majorVersion(metaData.getDatabaseMajorVersion())
            .url(metaData.getURL())
            .build();
    }
}
