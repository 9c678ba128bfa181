package work.lcod.ftml.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import work.lcod.ftml.model.DataRef;
import work.lcod.ftml.shared.Json;

/**
 * Append-only byte buffer of JSON-serialized values, addressed by {@link DataRef}.
 */
public final class DataBuffer {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    /**
     * Serializes {@code value} and appends it.
     *
     * @throws JsonProcessingException if the value cannot be serialized; nothing is appended then
     */
    public DataRef push(Object value) throws JsonProcessingException {
        byte[] encoded = Json.mapper().writeValueAsBytes(value);
        int start = bytes.size();
        bytes.writeBytes(encoded);
        return new DataRef(start, start + encoded.length);
    }

    public int size() {
        return bytes.size();
    }

    public byte[] toByteArray() {
        return bytes.toByteArray();
    }

    /** Reads the value at {@code ref} from a finished buffer. */
    public static JsonNode read(byte[] data, DataRef ref) throws IOException {
        if (ref.end() > data.length) {
            throw new IOException("data ref " + ref + " out of bounds for buffer of " + data.length + " bytes");
        }
        return Json.mapper().readTree(Arrays.copyOfRange(data, ref.start(), ref.end()));
    }

    public static <T> T read(byte[] data, DataRef ref, Class<T> type) throws IOException {
        if (ref.end() > data.length) {
            throw new IOException("data ref " + ref + " out of bounds for buffer of " + data.length + " bytes");
        }
        return Json.mapper().readValue(data, ref.start(), ref.length(), type);
    }
}
