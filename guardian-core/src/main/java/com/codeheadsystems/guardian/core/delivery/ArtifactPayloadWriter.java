package com.codeheadsystems.guardian.core.delivery;

import com.codeheadsystems.guardian.common.SecretBytes;
import com.codeheadsystems.guardian.core.model.Artifact;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.BufferRecycler;
import com.fasterxml.jackson.core.util.RecyclerPool;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import javax.inject.Singleton;

/**
 * Serializes artifacts into one JSON payload held in a {@link SecretBytes} buffer:
 * <pre>
 * [{"name":..., "value":..., "domain":..., "expiresAt": epochSeconds|null, "secure":..., "httpOnly":...}]
 * </pre>
 * Values are streamed straight from their buffers as UTF-8, never through a {@code String}.
 * The generator gets a fresh {@link ScrubbingBufferRecycler} per payload, which zero-fills every
 * encoding and concat buffer as Jackson hands it back, and the output stream's internal array is
 * zeroed once the payload is copied out. Copies the JVM itself makes (a resized output array
 * before collection, for one) are outside its reach.
 */
@Singleton
public class ArtifactPayloadWriter {

  private final JsonFactory jsonFactory;

  public ArtifactPayloadWriter() {
    this.jsonFactory = new JsonFactoryBuilder()
        .recyclerPool(new ScrubbingRecyclerPool())
        .build();
  }

  RecyclerPool<BufferRecycler> recyclerPool() {
    return jsonFactory._getRecyclerPool();
  }

  /**
   * Writes the payload.
   *
   * @param artifacts the artifacts
   * @return a buffer the caller must track and release
   */
  public SecretBytes write(final List<Artifact> artifacts) {
    int estimate = 2;
    for (Artifact artifact : artifacts) {
      estimate += 160 + artifact.name().length() + artifact.domain().length() + artifact.length() * 6;
    }
    ScrubbingOutputStream out = new ScrubbingOutputStream(estimate);
    try {
      try (JsonGenerator generator = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
        generator.writeStartArray();
        for (Artifact artifact : artifacts) {
          writeArtifact(generator, artifact);
        }
        generator.writeEndArray();
      }
      return SecretBytes.wrap(out.drain());
    } catch (IOException e) {
      throw new UncheckedIOException("Could not serialize artifact payload", e);
    } finally {
      out.scrub();
    }
  }

  private static void writeArtifact(final JsonGenerator generator, final Artifact artifact) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("name", artifact.name());
    generator.writeFieldName("value");
    byte[] value = artifact.value().view();
    generator.writeUTF8String(value, 0, value.length);
    generator.writeStringField("domain", artifact.domain());
    if (artifact.expiresAt().isPresent()) {
      generator.writeNumberField("expiresAt", artifact.expiresAt().get().getEpochSecond());
    } else {
      generator.writeNullField("expiresAt");
    }
    generator.writeBooleanField("secure", artifact.secure());
    generator.writeBooleanField("httpOnly", artifact.httpOnly());
    generator.writeEndObject();
  }

  /**
   * Hands out a new {@link ScrubbingBufferRecycler} for every generator and never reuses one.
   */
  static final class ScrubbingRecyclerPool implements RecyclerPool<BufferRecycler> {

    private static final long serialVersionUID = 1L;

    @Override
    public BufferRecycler acquirePooled() {
      return new ScrubbingBufferRecycler();
    }

    @Override
    public void releasePooled(final BufferRecycler pooled) {
      // dropped; its buffers were zeroed on release
    }
  }

  static final class ScrubbingBufferRecycler extends BufferRecycler {

    @Override
    public void releaseByteBuffer(final int ix, final byte[] buffer) {
      if (buffer != null) {
        Arrays.fill(buffer, (byte) 0);
      }
      super.releaseByteBuffer(ix, buffer);
    }

    @Override
    public void releaseCharBuffer(final int ix, final char[] buffer) {
      if (buffer != null) {
        Arrays.fill(buffer, '\0');
      }
      super.releaseCharBuffer(ix, buffer);
    }
  }

  private static final class ScrubbingOutputStream extends ByteArrayOutputStream {

    ScrubbingOutputStream(int size) {
      super(size);
    }

    synchronized byte[] drain() {
      byte[] copy = Arrays.copyOf(buf, count);
      scrub();
      return copy;
    }

    synchronized void scrub() {
      Arrays.fill(buf, (byte) 0);
      count = 0;
    }
  }
}
