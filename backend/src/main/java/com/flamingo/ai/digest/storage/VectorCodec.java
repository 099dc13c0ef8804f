package com.flamingo.ai.digest.storage;

import com.pgvector.PGvector;
import java.sql.SQLException;

/** Converts between float arrays and the pgvector text literal used in native queries. */
final class VectorCodec {

  private VectorCodec() {}

  static String toLiteral(float[] vector) {
    return new PGvector(vector).getValue();
  }

  static float[] fromLiteral(String literal) {
    try {
      return new PGvector(literal).toArray();
    } catch (SQLException e) {
      throw new IllegalArgumentException("Malformed vector literal", e);
    }
  }
}
