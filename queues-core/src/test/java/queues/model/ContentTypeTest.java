package queues.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContentTypeTest {

    @Test
    void resolvesTags() {
        for (ContentType type : ContentType.values()) {
            assertEquals(type, ContentType.fromTag(type.tag()));
        }
    }

    @Test
    void nullResolvesToDefault() {
        assertEquals(ContentType.OPAQUE, ContentType.fromTag(null));
    }

    @Test
    void unknownTagThrows() {
        assertThrows(IllegalArgumentException.class, () -> ContentType.fromTag("v8"));
    }
}
