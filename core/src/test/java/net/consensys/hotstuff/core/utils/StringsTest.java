package net.consensys.hotstuff.core.utils;

import org.junit.Assert;
import org.junit.Test;

public class StringsTest {

  static class Parent {
    static final int IGNORED = 3;
    final String name = "p";
  }

  static class Child extends Parent {
    final int count = 2;
    final String[] tags = {"x", "y"};
    final byte[] hash = new byte[4];
  }

  @Test
  public void testToString() {
    Assert.assertEquals(
        "Child{count=2, tags=[x, y], hash=byte[4], name=p}", Strings.toString(new Child()));
  }

  @Test
  public void testNoField() {
    Assert.assertEquals("Object{}", Strings.toString(new Object()));
  }
}
