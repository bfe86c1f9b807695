package net.consensys.hotstuff.core.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import net.consensys.hotstuff.core.WParameters;

/**
 * The mapper shared by the protocols: parameters and results are plain objects with final fields,
 * so we read & write the fields directly.
 */
public class ObjectMapperFactory {

  public static ObjectMapper objectMapper(Class<?>... subtypes) {
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.ANY);
    mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    for (Class<?> c : subtypes) {
      mapper.registerSubtypes(new NamedType(c, c.getSimpleName()));
    }

    return mapper;
  }

  /** Reads parameters from a json stream, the 'type' property naming the parameter class. */
  public static <T extends WParameters> T readParameters(InputStream is, Class<T> type) {
    try {
      T res = objectMapper(type).readValue(is, type);
      res.validate();
      return res;
    } catch (IOException e) {
      throw new UncheckedIOException("Can't read " + type.getSimpleName(), e);
    }
  }

  public static String toJson(Object o) {
    try {
      return objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(o);
    } catch (IOException e) {
      throw new UncheckedIOException("Can't serialize " + o.getClass().getSimpleName(), e);
    }
  }
}
