package com.docvault.store;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;
import java.io.Serializable;

@PrimaryKeyClass
public record EntryKey(
    @PrimaryKeyColumn(name = "namespace", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String namespace,

    @PrimaryKeyColumn(name = "entry_key", ordinal = 1, type = PrimaryKeyType.CLUSTERED)
    String key
) implements Serializable {}
