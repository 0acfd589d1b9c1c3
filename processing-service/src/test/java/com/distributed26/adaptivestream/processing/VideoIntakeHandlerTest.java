package com.distributed26.adaptivestream.processing;

import static org.junit.jupiter.api.Assertions.*;

import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.model.Visibility;
import java.util.List;
import org.junit.jupiter.api.Test;

class VideoIntakeHandlerTest {

    @Test
    void parseTags_trimsAndDropsDuplicates() {
        assertEquals(List.of("a", "b"), VideoIntakeHandler.parseTags(" a, b ,,a"));
        assertEquals(List.of(), VideoIntakeHandler.parseTags(null));
        assertEquals(List.of(), VideoIntakeHandler.parseTags("  "));
    }

    @Test
    void parseVisibility_defaultsToPublic() {
        assertEquals(Visibility.PUBLIC, VideoIntakeHandler.parseVisibility(null));
        assertEquals(Visibility.UNLISTED, VideoIntakeHandler.parseVisibility("unlisted"));
    }

    @Test
    void parseVisibility_unknownValue_rejected() {
        assertThrows(ValidationException.class, () -> VideoIntakeHandler.parseVisibility("friends-only"));
    }
}
