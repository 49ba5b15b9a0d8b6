package tech.manajer.platform.shared;

import jakarta.ws.rs.BadRequestException;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ObjectIdsTest {

    @Test
    @DisplayName("parse should return the id for a 24-char hex string")
    void parse_shouldReturnId_whenValid() {
        String hex = new ObjectId().toHexString();

        assertThat(ObjectIds.parse(hex, "Invalid id")).isEqualTo(new ObjectId(hex));
    }

    @Test
    @DisplayName("parse should throw BadRequestException with the given message when malformed")
    void parse_shouldThrow_whenMalformed() {
        assertThatThrownBy(() -> ObjectIds.parse("not-an-id", "Invalid channel ID"))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid channel ID");

        assertThatThrownBy(() -> ObjectIds.parse(null, "Invalid user ID"))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid user ID");
    }

    @Test
    @DisplayName("parseOptional should return null for absent values but reject malformed ones")
    void parseOptional_shouldTreatBlankAsAbsent() {
        assertThat(ObjectIds.parseOptional(null, "x")).isNull();
        assertThat(ObjectIds.parseOptional("  ", "x")).isNull();
        assertThatThrownBy(() -> ObjectIds.parseOptional("123", "Invalid user ID"))
            .isInstanceOf(BadRequestException.class);
    }
}
