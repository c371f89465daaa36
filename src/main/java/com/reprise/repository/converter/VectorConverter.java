package com.reprise.repository.converter;

import com.pgvector.PGvector;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.sql.SQLException;

/**
 * JPA converter between float arrays and the pgvector text form ({@code [1.0,2.0]}).
 */
@Converter
public class VectorConverter implements AttributeConverter<float[], String> {

    @Override
    public String convertToDatabaseColumn(float[] attribute) {
        if (attribute == null) {
            return null;
        }
        return new PGvector(attribute).getValue();
    }

    @Override
    public float[] convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        try {
            return new PGvector(dbData).toArray();
        } catch (SQLException e) {
            throw new IllegalArgumentException("Malformed vector value: " + dbData, e);
        }
    }

    /**
     * Text form for native query parameters.
     */
    public static String toVectorString(float[] vector) {
        return new PGvector(vector).getValue();
    }
}
