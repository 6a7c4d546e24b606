package com.skytrack.tracker.engine;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Picks a radio voice for a callsign from a fixed, ordered pool.
 *
 * <p>The choice is the MD5 digest of the UTF-8 callsign, read as an unsigned 128-bit integer,
 * modulo the pool size. No per-process seed is involved, so a callsign keeps its voice across
 * restarts and across implementations.
 */
public class VoiceAssigner {
  public static final List<String> DEFAULT_VOICES = List.of(
      "en-GB-RyanNeural",
      "en-US-GuyNeural",
      "en-AU-WilliamNeural",
      "en-IN-PrabhatNeural",
      "en-GB-ThomasNeural",
      "en-US-ChristopherNeural",
      "en-AU-NatashaNeural",
      "en-GB-SoniaNeural");

  private final List<String> voices;
  private final BigInteger poolSize;

  public VoiceAssigner(List<String> voices) {
    if (voices == null || voices.isEmpty()) {
      throw new IllegalArgumentException("voice pool must not be empty");
    }
    this.voices = List.copyOf(voices);
    this.poolSize = BigInteger.valueOf(this.voices.size());
  }

  public String assignVoice(String id) {
    byte[] digest = md5().digest(id.getBytes(StandardCharsets.UTF_8));
    int index = new BigInteger(1, digest).mod(poolSize).intValue();
    return voices.get(index);
  }

  private static MessageDigest md5() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 digest unavailable", ex);
    }
  }
}
