package net.consensys.hotstuff.protocols.hotstuff;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Signature tokens. There is no key and no verification: a token only tags the provenance of a
 * vote, and the same signer signing the same proposal always gets the same token.
 */
public final class Signatures {
  private static final char[] HEX = "0123456789abcdef".toCharArray();
  private static final int TOKEN_HEX_LENGTH = 6;

  private Signatures() {}

  public static String sign(String signerId, String proposalId) {
    if (signerId == null || proposalId == null) {
      throw new IllegalArgumentException("signerId=" + signerId + ", proposalId=" + proposalId);
    }
    byte[] h = sha256((signerId + "|" + proposalId).getBytes(StandardCharsets.UTF_8));
    StringBuilder sb = new StringBuilder(TOKEN_HEX_LENGTH);
    for (int i = 0; sb.length() < TOKEN_HEX_LENGTH; i++) {
      sb.append(HEX[(h[i] >> 4) & 0xF]).append(HEX[h[i] & 0xF]);
    }
    return "SIG(" + signerId + ":" + sb + ")";
  }

  private static byte[] sha256(byte[] data) {
    try {
      // MessageDigest instances are not thread safe, so we don't share one.
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }
}
