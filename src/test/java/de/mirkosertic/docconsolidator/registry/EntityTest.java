package de.mirkosertic.docconsolidator.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Entity")
class EntityTest {

    @Test
    @DisplayName("derives the folder name from trimmed keys")
    void folderName() {
        final Entity entity = new Entity(1, "AB-1", "  L1 ", " S1", "", EntityStatus.UNKNOWN);

        assertThat(entity.desiredFolderName()).isEqualTo("L1_S1");
        assertThat(entity.historyFolderName()).isEqualTo("L1_S1");
    }

    @Test
    @DisplayName("keeps an existing history name")
    void keepsHistory() {
        final Entity entity = new Entity(1, "AB-1", "L1", "S2", "L1_S1", EntityStatus.OK);

        assertThat(entity.historyFolderName()).isEqualTo("L1_S1");
        assertThat(entity.desiredFolderName()).isEqualTo("L1_S2");
    }

    @Test
    @DisplayName("parses status cells")
    void statusCells() {
        assertThat(EntityStatus.fromCell("")).isEqualTo(EntityStatus.UNKNOWN);
        assertThat(EntityStatus.fromCell(" ok ")).isEqualTo(EntityStatus.OK);
        assertThat(EntityStatus.fromCell("MISSING")).isEqualTo(EntityStatus.MISSING);
        assertThatThrownBy(() -> EntityStatus.fromCell("maybe")).isInstanceOf(IllegalArgumentException.class);
    }
}
