package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.finding.FindingType;
import com.architecture.memory.specaudit.dto.resolution.ChosenAction;
import com.architecture.memory.specaudit.dto.resolution.QueueName;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleActionChooserTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ConsoleActionChooser chooser(String input) {
        return new ConsoleActionChooser(new BufferedReader(new StringReader(input)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void appliesAlternative_whenItemOffersOne() {
        ChosenAction action = chooser("a\n").chooseAction(item("Create relationship b.y composed-of a.x"));

        assertThat(action.getChoice()).isEqualTo(ChosenAction.Choice.APPLY_ALTERNATIVE);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("Alternative: Create relationship b.y composed-of a.x");
    }

    @Test
    void repromptsForAlternative_whenNoneExists() {
        ChosenAction action = chooser("a\np\n").chooseAction(item(null));

        assertThat(action.getChoice()).isEqualTo(ChosenAction.Choice.APPLY_PRIMARY);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("No alternative for this item.");
    }

    @Test
    void readsCustomActionText() {
        ChosenAction action = chooser("c\nAdd attribute 'owner' to a.x\n").chooseAction(item(null));

        assertThat(action.getChoice()).isEqualTo(ChosenAction.Choice.CUSTOM);
        assertThat(action.getCustomText()).isEqualTo("Add attribute 'owner' to a.x");
    }

    @Test
    void skipsEveryItem_afterInputEnds() {
        ConsoleActionChooser chooser = chooser("");

        assertThat(chooser.chooseAction(item(null)).getChoice()).isEqualTo(ChosenAction.Choice.SKIP);
        assertThat(chooser.chooseAction(item(null)).getRationale()).isEqualTo("No input available");
    }

    private static ResolutionQueueItem item(String alternative) {
        return ResolutionQueueItem.builder()
                .position(1)
                .queue(QueueName.GAP_URGENT)
                .findingType(FindingType.GAP_CANDIDATE)
                .subject("a.x -[composes]-> b.y")
                .alignmentScore(15)
                .primarySuggestion("Create relationship a.x composes b.y")
                .alternativeSuggestion(alternative)
                .build();
    }
}
