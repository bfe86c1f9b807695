package net.consensys.hotstuff.core.json;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import net.consensys.hotstuff.core.WParameters;
import org.junit.Assert;
import org.junit.Test;

public class ObjectMapperFactoryTest {

  public static class SampleParameters extends WParameters {
    final int nodeCt;
    final String latencyName;

    public SampleParameters() {
      this(10, null);
    }

    public SampleParameters(int nodeCt, String latencyName) {
      this.nodeCt = nodeCt;
      this.latencyName = latencyName;
    }

    @Override
    public void validate() {
      if (nodeCt <= 0) {
        throw new IllegalArgumentException("nodeCt=" + nodeCt);
      }
    }
  }

  private static ByteArrayInputStream json(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testReadParameters() {
    SampleParameters p =
        ObjectMapperFactory.readParameters(
            json("{\"type\":\"SampleParameters\",\"nodeCt\":42,\"unknown\":true}"),
            SampleParameters.class);
    Assert.assertEquals(42, p.nodeCt);
    Assert.assertNull(p.latencyName);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testReadInvalidParameters() {
    ObjectMapperFactory.readParameters(
        json("{\"type\":\"SampleParameters\",\"nodeCt\":0}"), SampleParameters.class);
  }

  @Test
  public void testToJson() {
    String s = ObjectMapperFactory.toJson(new SampleParameters(3, "fixed"));
    Assert.assertTrue(s, s.contains("\"nodeCt\" : 3"));
    Assert.assertTrue(s, s.contains("\"latencyName\" : \"fixed\""));
  }
}
