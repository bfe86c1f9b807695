package net.consensys.hotstuff.core;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import net.consensys.hotstuff.core.utils.Strings;

/**
 * A value object containing all the parameters for a protocol. This can be serialized to/from a
 * json object, allowing to configure a run from a file or from a distant system.
 *
 * <p>Subclasses must have a public constructor without parameters setting the default values.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public abstract class WParameters {

  /**
   * Checks the parameters are consistent. Called before a run starts.
   *
   * @throws IllegalArgumentException if they are not.
   */
  public void validate() {}

  @Override
  public String toString() {
    return Strings.toString(this);
  }
}
