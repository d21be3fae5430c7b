package jp.naoj.pfs.redaction.infrastructure.persistence.json;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.DesignHeader;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.fiber.FocalPlanePoint;
import jp.naoj.pfs.redaction.domain.fiber.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams {@link ConfigurationSet}s to and from JSON documents.
 * <p><strong>Why:</strong> Gives the CLI a concrete, inspectable storage format without pulling a data-binding
 * layer into the domain model.</p>
 * <p><strong>Format:</strong> a {@code header} object ({@code frameId}, {@code pfsDesignId} as {@code 0x%016x},
 * {@code designName}, {@code proposalId}, optional {@code visit}) and a {@code fibers} array with one object
 * per row. Non-finite doubles are written as the strings {@code "NaN"}, {@code "Infinity"} and
 * {@code "-Infinity"} since JSON has no literal for them. Every fiber must carry {@code fiberId},
 * {@code proposalId}, {@code catId}, {@code objId} and {@code targetType}; other columns fall back to the
 * datamodel defaults.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; {@link JsonFactory} is shared and every call owns its parser
 * or generator.</p>
 *
 * @since 0.1.0
 */
public final class JsonConfigurationCodec {
  private static final Logger log = LoggerFactory.getLogger(JsonConfigurationCodec.class);
  // columns the masking predicate and object-id derivation read; a row without them cannot be redacted
  private static final List<String> REQUIRED_FIBER_FIELDS =
      List.of("proposalId", "catId", "objId", "targetType");

  private final JsonFactory factory = new JsonFactory();
  private final boolean prettyPrint;

  public JsonConfigurationCodec() {
    this(true);
  }

  /**
   * Creates a codec.
   *
   * @param prettyPrint whether written documents are indented
   */
  public JsonConfigurationCodec(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  /**
   * Writes a configuration. The stream is flushed but not closed.
   *
   * @param set configuration to write
   * @param out destination stream
   * @throws IOException when writing fails
   */
  public void write(ConfigurationSet set, OutputStream out) throws IOException {
    try (JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (prettyPrint) {
        generator.useDefaultPrettyPrinter();
      }
      generator.writeStartObject();
      writeHeader(generator, set.header());
      generator.writeArrayFieldStart("fibers");
      for (FiberRecord row : set.rows()) {
        writeFiber(generator, row);
      }
      generator.writeEndArray();
      generator.writeEndObject();
    }
  }

  /**
   * Reads a configuration. The stream is not closed.
   *
   * @param in source stream
   * @return parsed configuration
   * @throws IOException when the document is malformed or a value is out of range
   */
  public ConfigurationSet read(InputStream in) throws IOException {
    try (JsonParser parser = factory.createParser(in)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      expect(parser, parser.nextToken(), JsonToken.START_OBJECT);
      DesignHeader header = null;
      List<FiberRecord> rows = null;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String name = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (name) {
          case "header" -> header = readHeader(parser, value);
          case "fibers" -> rows = readFibers(parser, value);
          default -> skip(parser, name);
        }
      }
      expect(parser, parser.currentToken(), JsonToken.END_OBJECT);
      if (header == null) {
        throw new JsonParseException(parser, "configuration document has no header");
      }
      if (rows == null) {
        throw new JsonParseException(parser, "configuration document has no fibers array");
      }
      return new ConfigurationSet(header, rows);
    }
  }

  private static void writeHeader(JsonGenerator generator, DesignHeader header) throws IOException {
    generator.writeObjectFieldStart("header");
    generator.writeStringField("frameId", header.frameId());
    generator.writeStringField("pfsDesignId", header.designIdHex());
    generator.writeStringField("designName", header.designName());
    generator.writeStringField("proposalId", header.proposalId());
    if (header.visit().isPresent()) {
      generator.writeNumberField("visit", header.visit().getAsInt());
    }
    generator.writeEndObject();
  }

  private static void writeFiber(JsonGenerator generator, FiberRecord row) throws IOException {
    generator.writeStartObject();
    generator.writeNumberField("fiberId", row.fiberId());
    generator.writeStringField("proposalId", row.proposalId());
    generator.writeNumberField("catId", row.catId());
    generator.writeNumberField("objId", row.objId());
    generator.writeStringField("targetType", row.targetType().name());
    generator.writeNumberField("tract", row.tract());
    generator.writeStringField("patch", row.patch());
    writeDouble(generator, "ra", row.ra());
    writeDouble(generator, "dec", row.dec());
    writeDouble(generator, "pmRa", row.pmRa());
    writeDouble(generator, "pmDec", row.pmDec());
    writeDouble(generator, "parallax", row.parallax());
    generator.writeStringField("obCode", row.obCode());
    writePoint(generator, "pfiNominal", row.pfiNominal());
    writePoint(generator, "pfiCenter", row.pfiCenter());
    for (FluxField field : FluxField.values()) {
      generator.writeArrayFieldStart(field.columnName());
      for (double value : row.flux(field)) {
        writeDoubleValue(generator, value);
      }
      generator.writeEndArray();
    }
    generator.writeArrayFieldStart("filterNames");
    for (String filter : row.filterNames()) {
      generator.writeString(filter);
    }
    generator.writeEndArray();
    generator.writeEndObject();
  }

  private static void writePoint(JsonGenerator generator, String name, FocalPlanePoint point) throws IOException {
    generator.writeArrayFieldStart(name);
    writeDoubleValue(generator, point.x());
    writeDoubleValue(generator, point.y());
    generator.writeEndArray();
  }

  private static void writeDouble(JsonGenerator generator, String name, double value) throws IOException {
    generator.writeFieldName(name);
    writeDoubleValue(generator, value);
  }

  private static void writeDoubleValue(JsonGenerator generator, double value) throws IOException {
    if (Double.isFinite(value)) {
      generator.writeNumber(value);
    } else {
      generator.writeString(Double.toString(value));
    }
  }

  private DesignHeader readHeader(JsonParser parser, JsonToken start) throws IOException {
    expect(parser, start, JsonToken.START_OBJECT);
    String frameId = "";
    long designId = 0L;
    String designName = "";
    String proposalId = FiberRecord.NO_PROPOSAL;
    OptionalInt visit = OptionalInt.empty();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String name = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (name) {
        case "frameId" -> frameId = readString(parser, value);
        case "pfsDesignId" -> designId = readDesignId(parser, value);
        case "designName" -> designName = readString(parser, value);
        case "proposalId" -> proposalId = readString(parser, value);
        case "visit" -> visit = value == JsonToken.VALUE_NULL ? OptionalInt.empty() : OptionalInt.of(readInt(parser, value));
        default -> skip(parser, "header." + name);
      }
    }
    return new DesignHeader(frameId, designId, designName, proposalId, visit);
  }

  private List<FiberRecord> readFibers(JsonParser parser, JsonToken start) throws IOException {
    expect(parser, start, JsonToken.START_ARRAY);
    List<FiberRecord> rows = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      rows.add(readFiber(parser, token));
    }
    return rows;
  }

  private FiberRecord readFiber(JsonParser parser, JsonToken start) throws IOException {
    expect(parser, start, JsonToken.START_OBJECT);
    FiberRecord.Builder builder = FiberRecord.builder();
    boolean hasFiberId = false;
    int fiberId = 0;
    Set<String> seen = new HashSet<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String name = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      seen.add(name);
      switch (name) {
        case "fiberId" -> {
          fiberId = readInt(parser, value);
          builder.fiberId(fiberId);
          hasFiberId = true;
        }
        case "proposalId" -> builder.proposalId(readString(parser, value));
        case "catId" -> builder.catId(readInt(parser, value));
        case "objId" -> builder.objId(readLong(parser, value));
        case "targetType" -> builder.targetType(readTargetType(parser, value));
        case "tract" -> builder.tract(readInt(parser, value));
        case "patch" -> builder.patch(readString(parser, value));
        case "ra" -> builder.ra(readDouble(parser, value));
        case "dec" -> builder.dec(readDouble(parser, value));
        case "pmRa" -> builder.pmRa(readDouble(parser, value));
        case "pmDec" -> builder.pmDec(readDouble(parser, value));
        case "parallax" -> builder.parallax(readDouble(parser, value));
        case "obCode" -> builder.obCode(readString(parser, value));
        case "pfiNominal" -> builder.pfiNominal(readPoint(parser, value));
        case "pfiCenter" -> builder.pfiCenter(readPoint(parser, value));
        case "filterNames" -> builder.filterNames(readStrings(parser, value));
        default -> {
          FluxField flux = fluxField(name);
          if (flux != null) {
            builder.flux(flux, readDoubles(parser, value));
          } else {
            skip(parser, "fibers[]." + name);
          }
        }
      }
    }
    if (!hasFiberId) {
      throw new JsonParseException(parser, "fiber entry has no fiberId");
    }
    List<String> missing = new ArrayList<>();
    for (String field : REQUIRED_FIBER_FIELDS) {
      if (!seen.contains(field)) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      throw new JsonParseException(parser, "fiber " + fiberId + " is missing required field(s) " + missing);
    }
    return builder.build();
  }

  private static FluxField fluxField(String name) {
    for (FluxField field : FluxField.values()) {
      if (field.columnName().equals(name)) {
        return field;
      }
    }
    return null;
  }

  private static String readString(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.VALUE_STRING) {
      throw new JsonParseException(parser, "expected string for " + parser.getCurrentName() + " but found " + token);
    }
    return parser.getText();
  }

  private static int readInt(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.VALUE_NUMBER_INT) {
      throw new JsonParseException(parser, "expected integer for " + parser.getCurrentName() + " but found " + token);
    }
    return parser.getIntValue();
  }

  private static long readLong(JsonParser parser, JsonToken token) throws IOException {
    if (token != JsonToken.VALUE_NUMBER_INT) {
      throw new JsonParseException(parser, "expected integer for " + parser.getCurrentName() + " but found " + token);
    }
    return parser.getLongValue();
  }

  private static long readDesignId(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NUMBER_INT) {
      return parser.getBigIntegerValue().longValue();
    }
    String text = readString(parser, token).trim().toLowerCase(Locale.ROOT);
    String digits = text.startsWith("0x") ? text.substring(2) : text;
    try {
      return Long.parseUnsignedLong(digits, text.startsWith("0x") ? 16 : 10);
    } catch (NumberFormatException ex) {
      throw new JsonParseException(parser, "invalid pfsDesignId " + text, ex);
    }
  }

  private static double readDouble(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
      return parser.getDoubleValue();
    }
    if (token == JsonToken.VALUE_STRING) {
      switch (parser.getText()) {
        case "NaN":
          return Double.NaN;
        case "Infinity":
          return Double.POSITIVE_INFINITY;
        case "-Infinity":
          return Double.NEGATIVE_INFINITY;
        default:
          break;
      }
    }
    throw new JsonParseException(parser, "expected number for " + parser.getCurrentName() + " but found " + token);
  }

  private static TargetType readTargetType(JsonParser parser, JsonToken token) throws IOException {
    try {
      if (token == JsonToken.VALUE_NUMBER_INT) {
        return TargetType.fromCode(parser.getIntValue());
      }
      return TargetType.parse(readString(parser, token));
    } catch (IllegalArgumentException ex) {
      throw new JsonParseException(parser, "invalid targetType: " + ex.getMessage(), ex);
    }
  }

  private static FocalPlanePoint readPoint(JsonParser parser, JsonToken token) throws IOException {
    double[] values = readDoubles(parser, token);
    if (values.length != 2) {
      throw new JsonParseException(parser, "focal-plane point needs 2 values, found " + values.length);
    }
    return new FocalPlanePoint(values[0], values[1]);
  }

  private static double[] readDoubles(JsonParser parser, JsonToken start) throws IOException {
    expect(parser, start, JsonToken.START_ARRAY);
    double[] values = new double[8];
    int size = 0;
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (size == values.length) {
        values = Arrays.copyOf(values, size * 2);
      }
      values[size++] = readDouble(parser, token);
    }
    return Arrays.copyOf(values, size);
  }

  private static List<String> readStrings(JsonParser parser, JsonToken start) throws IOException {
    expect(parser, start, JsonToken.START_ARRAY);
    List<String> values = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      values.add(readString(parser, token));
    }
    return values;
  }

  private static void expect(JsonParser parser, JsonToken actual, JsonToken expected) throws IOException {
    if (actual != expected) {
      throw new JsonParseException(parser, "expected " + expected + " but found " + actual);
    }
  }

  private static void skip(JsonParser parser, String name) throws IOException {
    log.debug("Ignoring unknown field {}", name);
    parser.skipChildren();
  }
}
