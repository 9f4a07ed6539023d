package eventmanager.hash;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 32-bit MurmurHash3 (x86_32 variant).
 *
 * <p>Output is bit-exact with the reference implementation for every seed, so identifiers
 * computed by independent processes over the same bytes and seed agree. Input is consumed in
 * 4-byte little-endian blocks regardless of platform byte order.
 *
 * <p>Not a cryptographic hash.
 */
public final class Murmur3 {

  private static final int C1 = 0xcc9e2d51;
  private static final int C2 = 0x1b873593;
  private static final int BLOCK_ADD = 0xe6546b64;
  private static final int FMIX_1 = 0x85ebca6b;
  private static final int FMIX_2 = 0xc2b2ae35;

  private Murmur3() {}

  /**
   * Hashes the UTF-8 encoding of {@code text}.
   *
   * @param text the text to hash
   * @param seed the seed
   * @return the 32-bit hash
   */
  public static int hash32(CharSequence text, int seed) {
    Objects.requireNonNull(text, "text");
    byte[] bytes = text.toString().getBytes(StandardCharsets.UTF_8);
    return hash32(bytes, 0, bytes.length, seed);
  }

  public static int hash32(byte[] data, int seed) {
    Objects.requireNonNull(data, "data");
    return hash32(data, 0, data.length, seed);
  }

  public static int hash32(byte[] data, int length, int seed) {
    return hash32(data, 0, length, seed);
  }

  /**
   * Hashes {@code length} bytes of {@code data} starting at {@code offset}.
   *
   * @param data   the input bytes
   * @param offset index of the first byte to hash
   * @param length number of bytes to hash
   * @param seed   the seed
   * @return the 32-bit hash
   * @throws NullPointerException      if {@code data} is null
   * @throws IndexOutOfBoundsException if the range lies outside {@code data}
   */
  public static int hash32(byte[] data, int offset, int length, int seed) {
    Objects.requireNonNull(data, "data");
    Objects.checkFromIndexSize(offset, length, data.length);

    int hash = seed;
    int blockEnd = offset + (length & ~3);

    for (int i = offset; i < blockEnd; i += 4) {
      int k = (data[i] & 0xff)
          | (data[i + 1] & 0xff) << 8
          | (data[i + 2] & 0xff) << 16
          | (data[i + 3] & 0xff) << 24;
      hash ^= mixK(k);
      hash = Integer.rotateLeft(hash, 13);
      hash = hash * 5 + BLOCK_ADD;
    }

    // tail only xors into the hash; no rotate/add step
    int k = 0;
    switch (length & 3) {
      case 3:
        k ^= (data[blockEnd + 2] & 0xff) << 16;
        // fall through
      case 2:
        k ^= (data[blockEnd + 1] & 0xff) << 8;
        // fall through
      case 1:
        k ^= data[blockEnd] & 0xff;
        hash ^= mixK(k);
        break;
      default:
        break;
    }

    hash ^= length;
    return fmix(hash);
  }

  private static int mixK(int k) {
    k *= C1;
    k = Integer.rotateLeft(k, 15);
    k *= C2;
    return k;
  }

  static int fmix(int hash) {
    hash ^= hash >>> 16;
    hash *= FMIX_1;
    hash ^= hash >>> 13;
    hash *= FMIX_2;
    hash ^= hash >>> 16;
    return hash;
  }
}
