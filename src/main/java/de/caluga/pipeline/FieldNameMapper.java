package de.caluga.pipeline;

/**
 * translates field names used in java code into the names stored in mongo
 */
public interface FieldNameMapper {
    String getMongoFieldName(String javaName);
}
