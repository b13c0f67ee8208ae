package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.ChosenAction;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Interactive chooser reading one answer per item. End of input skips every remaining item.
 */
public class ConsoleActionChooser implements ActionChooser {

    private final BufferedReader in;
    private final PrintStream out;
    private boolean exhausted;

    public ConsoleActionChooser(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public ChosenAction chooseAction(ResolutionQueueItem item) {
        printItem(item);
        while (!exhausted) {
            out.print(item.hasAlternative()
                    ? "[p]rimary, [a]lternative, [s]kip, [c]ustom > "
                    : "[p]rimary, [s]kip, [c]ustom > ");
            out.flush();
            String answer = readLine();
            if (answer == null) {
                break;
            }
            switch (answer.trim().toLowerCase(Locale.ROOT)) {
                case "p", "primary" -> {
                    return ChosenAction.applyPrimary("Selected interactively");
                }
                case "a", "alternative" -> {
                    if (item.hasAlternative()) {
                        return ChosenAction.applyAlternative("Selected interactively");
                    }
                    out.println("No alternative for this item.");
                }
                case "s", "skip", "" -> {
                    return ChosenAction.skip("Skipped interactively");
                }
                case "c", "custom" -> {
                    out.print("Action > ");
                    out.flush();
                    String text = readLine();
                    if (text != null && !text.isBlank()) {
                        return ChosenAction.custom(text.trim());
                    }
                }
                default -> out.println("Unrecognized answer: " + answer);
            }
        }
        return ChosenAction.skip("No input available");
    }

    private void printItem(ResolutionQueueItem item) {
        out.println();
        out.printf(Locale.ROOT, "#%d [%s] %s%n", item.getPosition(), item.getQueue(), item.getSubject());
        out.printf(Locale.ROOT, "  %s, alignment %d, %s, %s%n", item.getFindingType(), item.getAlignmentScore(),
                item.getActionKind(), item.getRoiTier());
        if (item.getFinding() != null && item.getFinding().getReasoning() != null) {
            out.println("  Why: " + item.getFinding().getReasoning());
        }
        out.println("  Primary: " + item.getPrimarySuggestion());
        if (item.hasAlternative()) {
            out.println("  Alternative: " + item.getAlternativeSuggestion());
        }
    }

    private String readLine() {
        try {
            String line = in.readLine();
            if (line == null) {
                exhausted = true;
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read answer", e);
        }
    }
}
