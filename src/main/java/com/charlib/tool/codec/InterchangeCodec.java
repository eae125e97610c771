package com.charlib.tool.codec;

import static com.charlib.tool.codec.InterchangeFields.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.exception.MalformedDocumentException;
import com.charlib.tool.model.CapacitanceRange;
import com.charlib.tool.model.Cell;
import com.charlib.tool.model.InputPin;
import com.charlib.tool.model.LeakagePower;
import com.charlib.tool.model.LibrarySnapshot;
import com.charlib.tool.model.Lut;
import com.charlib.tool.model.OutputPin;
import com.charlib.tool.model.PowerArc;
import com.charlib.tool.model.PowerLutSlot;
import com.charlib.tool.model.Pvt;
import com.charlib.tool.model.TimingArc;
import com.charlib.tool.model.TimingLutSlot;
import com.charlib.tool.util.FileWriteUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts between {@link LibrarySnapshot} and the JSON interchange document.
 *
 * <p>Encoding omits every absent optional field; decoding reads an omitted field as absent.
 * The only defaulted field is a leakage {@code value}, which decodes to {@code 0.0}.
 * Unknown fields are ignored. Any other deviation from the schema raises
 * {@link MalformedDocumentException} carrying the JSON path of the offending field,
 * e.g. {@code cells[0].output_pins[1].timing_arcs[0].cell_rise.values[2][0]}.</p>
 *
 * Instances are stateless and thread-safe.
 */
public class InterchangeCodec {
    private static final Logger log = LoggerFactory.getLogger(InterchangeCodec.class);

    /** Read-only stand-in for an omitted array field. */
    private static final JsonNode NO_ELEMENTS = JsonNodeFactory.instance.arrayNode();

    private final ObjectMapper objectMapper;

    public InterchangeCodec() {
        this(new ObjectMapper());
    }

    public InterchangeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ---------------------------------------------------------------- encode

    public String encode(LibrarySnapshot snapshot, boolean pretty) {
        ObjectNode document = toDocument(snapshot);
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            // a tree of plain nodes always serializes
            throw new IllegalStateException("Failed to serialize interchange document", e);
        }
    }

    /**
     * Writes an already encoded document, creating parent directories as needed.
     */
    public void write(String document, Path destination) throws IOException {
        FileWriteUtil.safeWriteString(destination, document + System.lineSeparator());
        log.debug("Wrote interchange document {}", destination);
    }

    public ObjectNode toDocument(LibrarySnapshot snapshot) {
        ObjectNode root = objectMapper.createObjectNode();
        Pvt pvt = snapshot.getPvt();
        root.put(VOLTAGE, pvt.getVoltage());
        root.put(TEMPERATURE, pvt.getTemperature());
        ArrayNode process = root.putArray(PROCESS);
        pvt.getProcess().forEach(process::add);

        ArrayNode cells = root.putArray(CELLS);
        for (Cell cell : snapshot.getCells()) {
            cells.add(encodeCell(cell));
        }
        return root;
    }

    private ObjectNode encodeCell(Cell cell) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(CELL_NAME, cell.getCellName());
        if (!cell.getOutputPins().isEmpty()) {
            ArrayNode pins = node.putArray(OUTPUT_PINS);
            cell.getOutputPins().forEach(pin -> pins.add(encodeOutputPin(pin)));
        }
        if (!cell.getInputPins().isEmpty()) {
            ArrayNode pins = node.putArray(INPUT_PINS);
            cell.getInputPins().forEach(pin -> pins.add(encodeInputPin(pin)));
        }
        if (!cell.getLeakagePowers().isEmpty()) {
            ArrayNode leakages = node.putArray(LEAKAGE_POWER);
            cell.getLeakagePowers().forEach(leakage -> leakages.add(encodeLeakage(leakage)));
        }
        return node;
    }

    private ObjectNode encodeLeakage(LeakagePower leakage) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(VALUE, leakage.getValue());
        putIfNotEmpty(node, WHEN, leakage.getWhen());
        putIfNotEmpty(node, RELATED_PG_PIN, leakage.getRelatedPgPin());
        return node;
    }

    private ObjectNode encodeOutputPin(OutputPin pin) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(PIN_NAME, pin.getPinName());
        putIfNotEmpty(node, FUNCTION, pin.getFunction());
        encodeArcs(node, pin.getTimingArcs(), pin.getPowerArcs());
        return node;
    }

    private ObjectNode encodeInputPin(InputPin pin) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(PIN_NAME, pin.getPinName());
        putIfPresent(node, CAPACITANCE, pin.getCapacitance());
        putIfPresent(node, RISE_CAPACITANCE, pin.getRiseCapacitance());
        putIfPresent(node, FALL_CAPACITANCE, pin.getFallCapacitance());
        putRange(node, RISE_CAPACITANCE_RANGE, pin.getRiseCapacitanceRange());
        putRange(node, FALL_CAPACITANCE_RANGE, pin.getFallCapacitanceRange());
        encodeArcs(node, pin.getTimingArcs(), pin.getPowerArcs());
        return node;
    }

    private void encodeArcs(ObjectNode pinNode, List<TimingArc> timingArcs, List<PowerArc> powerArcs) {
        if (!timingArcs.isEmpty()) {
            ArrayNode arcs = pinNode.putArray(TIMING_ARCS);
            timingArcs.forEach(arc -> arcs.add(encodeTimingArc(arc)));
        }
        if (!powerArcs.isEmpty()) {
            ArrayNode arcs = pinNode.putArray(POWER_ARCS);
            powerArcs.forEach(arc -> arcs.add(encodePowerArc(arc)));
        }
    }

    private ObjectNode encodeTimingArc(TimingArc arc) {
        ObjectNode node = objectMapper.createObjectNode();
        putIfNotEmpty(node, WHEN, arc.getWhen());
        putIfNotEmpty(node, RELATED_PIN, arc.getRelatedPin());
        putIfNotEmpty(node, TIMING_TYPE, arc.getTimingType());
        putIfNotEmpty(node, TIMING_SENSE, arc.getTimingSense());
        for (TimingLutSlot slot : TimingLutSlot.values()) {
            putLut(node, slot.getDocumentKey(), arc.lut(slot));
        }
        return node;
    }

    private ObjectNode encodePowerArc(PowerArc arc) {
        ObjectNode node = objectMapper.createObjectNode();
        putIfNotEmpty(node, WHEN, arc.getWhen());
        putIfNotEmpty(node, RELATED_PIN, arc.getRelatedPin());
        putIfNotEmpty(node, RELATED_PG_PIN, arc.getRelatedPgPin());
        for (PowerLutSlot slot : PowerLutSlot.values()) {
            putLut(node, slot.getDocumentKey(), arc.lut(slot));
        }
        return node;
    }

    private void putLut(ObjectNode parent, String field, Lut lut) {
        if (!lut.isPresent()) {
            return;
        }
        ObjectNode node = parent.putObject(field);
        if (!lut.getIndex1().isEmpty()) {
            ArrayNode index1 = node.putArray(INDEX1);
            lut.getIndex1().forEach(index1::add);
        }
        if (!lut.getIndex2().isEmpty()) {
            ArrayNode index2 = node.putArray(INDEX2);
            lut.getIndex2().forEach(index2::add);
        }
        if (!lut.getValues().isEmpty()) {
            ArrayNode values = node.putArray(VALUES);
            for (List<Double> row : lut.getValues()) {
                ArrayNode rowNode = values.addArray();
                row.forEach(rowNode::add);
            }
        }
    }

    /**
     * The document carries ranges as a number pair; a missing bound is written as 0.0.
     */
    private static void putRange(ObjectNode node, String field, CapacitanceRange range) {
        if (range == null || !range.isPresent()) {
            return;
        }
        node.putArray(field)
                .add(range.getLower() != null ? range.getLower() : 0.0)
                .add(range.getUpper() != null ? range.getUpper() : 0.0);
    }

    private static void putIfPresent(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putIfNotEmpty(ObjectNode node, String field, String value) {
        if (!value.isEmpty()) {
            node.put(field, value);
        }
    }

    // ---------------------------------------------------------------- decode

    public LibrarySnapshot decode(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("", "Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return fromDocument(root);
    }

    public LibrarySnapshot decode(Path document) throws IOException {
        log.debug("Reading interchange document {}", document);
        return decode(Files.readString(document, StandardCharsets.UTF_8));
    }

    public LibrarySnapshot fromDocument(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedDocumentException("", "Document must be a JSON object");
        }

        Pvt.PvtBuilder pvt = Pvt.builder()
                .voltage(optionalNumber(root, VOLTAGE, "").orElse(0.0))
                .temperature(optionalInt(root, TEMPERATURE, ""));
        JsonNode process = optionalArray(root, PROCESS, "");
        for (int i = 0; i < process.size(); i++) {
            pvt.processValue(requireInt(process.get(i), indexPath(PROCESS, i)));
        }

        LibrarySnapshot.LibrarySnapshotBuilder snapshot = LibrarySnapshot.builder().pvt(pvt.build());
        snapshot.cells(decodeArray(root, CELLS, "", this::decodeCell));
        return snapshot.build();
    }

    private Cell decodeCell(JsonNode node, String path) {
        requireObject(node, path);
        return Cell.builder()
                .cellName(requireString(node, CELL_NAME, path))
                .outputPins(decodeArray(node, OUTPUT_PINS, path, this::decodeOutputPin))
                .inputPins(decodeArray(node, INPUT_PINS, path, this::decodeInputPin))
                .leakagePowers(decodeArray(node, LEAKAGE_POWER, path, this::decodeLeakage))
                .build();
    }

    private LeakagePower decodeLeakage(JsonNode node, String path) {
        requireObject(node, path);
        return LeakagePower.builder()
                .value(optionalNumber(node, VALUE, path).orElse(0.0))
                .when(optionalString(node, WHEN, path))
                .relatedPgPin(optionalString(node, RELATED_PG_PIN, path))
                .build();
    }

    private OutputPin decodeOutputPin(JsonNode node, String path) {
        requireObject(node, path);
        return OutputPin.builder()
                .pinName(requireString(node, PIN_NAME, path))
                .function(optionalString(node, FUNCTION, path))
                .timingArcs(decodeArray(node, TIMING_ARCS, path, this::decodeTimingArc))
                .powerArcs(decodeArray(node, POWER_ARCS, path, this::decodePowerArc))
                .build();
    }

    private InputPin decodeInputPin(JsonNode node, String path) {
        requireObject(node, path);
        return InputPin.builder()
                .pinName(requireString(node, PIN_NAME, path))
                .capacitance(optionalNumber(node, CAPACITANCE, path).orElse(null))
                .riseCapacitance(optionalNumber(node, RISE_CAPACITANCE, path).orElse(null))
                .fallCapacitance(optionalNumber(node, FALL_CAPACITANCE, path).orElse(null))
                .riseCapacitanceRange(decodeRange(node, RISE_CAPACITANCE_RANGE, path))
                .fallCapacitanceRange(decodeRange(node, FALL_CAPACITANCE_RANGE, path))
                .timingArcs(decodeArray(node, TIMING_ARCS, path, this::decodeTimingArc))
                .powerArcs(decodeArray(node, POWER_ARCS, path, this::decodePowerArc))
                .build();
    }

    private TimingArc decodeTimingArc(JsonNode node, String path) {
        requireObject(node, path);
        TimingArc.TimingArcBuilder arc = TimingArc.builder()
                .when(optionalString(node, WHEN, path))
                .relatedPin(optionalString(node, RELATED_PIN, path))
                .timingType(optionalString(node, TIMING_TYPE, path))
                .timingSense(optionalString(node, TIMING_SENSE, path));
        for (TimingLutSlot slot : TimingLutSlot.values()) {
            Lut lut = decodeLut(node, slot.getDocumentKey(), path);
            if (lut.isPresent()) {
                arc.lut(slot, lut);
            }
        }
        return arc.build();
    }

    private PowerArc decodePowerArc(JsonNode node, String path) {
        requireObject(node, path);
        PowerArc.PowerArcBuilder arc = PowerArc.builder()
                .when(optionalString(node, WHEN, path))
                .relatedPin(optionalString(node, RELATED_PIN, path))
                .relatedPgPin(optionalString(node, RELATED_PG_PIN, path));
        for (PowerLutSlot slot : PowerLutSlot.values()) {
            Lut lut = decodeLut(node, slot.getDocumentKey(), path);
            if (lut.isPresent()) {
                arc.lut(slot, lut);
            }
        }
        return arc.build();
    }

    private Lut decodeLut(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return Lut.EMPTY;
        }
        String path = fieldPath(parentPath, field);
        requireObject(node, path);
        List<List<Double>> rows = new ArrayList<>();
        JsonNode values = optionalArray(node, VALUES, path);
        for (int i = 0; i < values.size(); i++) {
            String rowPath = indexPath(fieldPath(path, VALUES), i);
            rows.add(decodeNumbers(values.get(i), rowPath));
        }
        return Lut.builder()
                .index1(decodeNumberArray(node, INDEX1, path))
                .index2(decodeNumberArray(node, INDEX2, path))
                .values(rows)
                .build();
    }

    /**
     * A range must be a pair of numbers.
     */
    private CapacitanceRange decodeRange(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String path = fieldPath(parentPath, field);
        List<Double> bounds = decodeNumbers(node, path);
        if (bounds.size() != 2) {
            throw new MalformedDocumentException(path, "Expected 2 numbers but found " + bounds.size());
        }
        return CapacitanceRange.of(bounds.get(0), bounds.get(1));
    }

    // ---------------------------------------------------------------- decode helpers

    private <T> List<T> decodeArray(JsonNode parent, String field, String parentPath,
                                    BiFunction<JsonNode, String, T> decoder) {
        JsonNode array = optionalArray(parent, field, parentPath);
        String path = fieldPath(parentPath, field);
        List<T> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            result.add(decoder.apply(array.get(i), indexPath(path, i)));
        }
        return result;
    }

    private List<Double> decodeNumberArray(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        return decodeNumbers(node, fieldPath(parentPath, field));
    }

    private static List<Double> decodeNumbers(JsonNode node, String path) {
        if (!node.isArray()) {
            throw new MalformedDocumentException(path, "Expected an array of numbers but found " + node.getNodeType());
        }
        List<Double> numbers = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            numbers.add(requireNumber(node.get(i), indexPath(path, i)));
        }
        return numbers;
    }

    private static JsonNode optionalArray(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return NO_ELEMENTS;
        }
        if (!node.isArray()) {
            throw new MalformedDocumentException(fieldPath(parentPath, field),
                    "Expected an array but found " + node.getNodeType());
        }
        return node;
    }

    private static Optional<Double> optionalNumber(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(requireNumber(node, fieldPath(parentPath, field)));
    }

    private static int optionalInt(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return 0;
        }
        return requireInt(node, fieldPath(parentPath, field));
    }

    private static String optionalString(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isTextual()) {
            throw new MalformedDocumentException(fieldPath(parentPath, field),
                    "Expected a string but found " + node.getNodeType());
        }
        return node.asText();
    }

    private static String requireString(JsonNode parent, String field, String parentPath) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new MalformedDocumentException(fieldPath(parentPath, field), "Required field is missing");
        }
        return optionalString(parent, field, parentPath);
    }

    private static double requireNumber(JsonNode node, String path) {
        if (node == null || !node.isNumber()) {
            throw new MalformedDocumentException(path,
                    "Expected a number but found " + (node == null ? "nothing" : node.getNodeType()));
        }
        return node.doubleValue();
    }

    private static int requireInt(JsonNode node, String path) {
        double value = requireNumber(node, path);
        if (!node.canConvertToInt() || value != Math.rint(value)) {
            throw new MalformedDocumentException(path, "Expected an integer but found " + node.asText());
        }
        return (int) value;
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new MalformedDocumentException(path,
                    "Expected an object but found " + (node == null ? "nothing" : node.getNodeType()));
        }
    }

    private static String fieldPath(String parentPath, String field) {
        return parentPath.isEmpty() ? field : parentPath + "." + field;
    }

    private static String indexPath(String path, int index) {
        return path + "[" + index + "]";
    }
}
