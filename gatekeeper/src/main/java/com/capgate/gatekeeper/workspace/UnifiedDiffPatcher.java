package com.capgate.gatekeeper.workspace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies single-file unified-diff text to a string.
 *
 * Strict: every context and removal line must match the base content
 * exactly, hunk line counts must add up (a body line left over after the
 * counts are used up is an error, not noise), and hunks must be in
 * ascending, non-overlapping order. Anything else throws {@link PatchMismatchException}.
 *
 * <p>Patch shapes accepted:
 * <ul>
 *   <li>Regular hunks ({@code @@ -a,b +c,d @@}), optionally preceded by
 *       {@code diff}/{@code index}/{@code ---}/{@code +++} header lines.</li>
 *   <li>A body with no hunk header at all, read as one hunk starting at
 *       line 1 whose length is whatever the body contains.</li>
 * </ul>
 *
 * Line endings are split on {@code \n} only, so CRLF files keep their
 * {@code \r} on both sides and still match.
 */
public final class UnifiedDiffPatcher {

    private static final Pattern HUNK_HEADER = Pattern.compile(
            "^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$");

    private UnifiedDiffPatcher() {}

    /** Thrown when a patch does not apply cleanly to the given base. */
    public static class PatchMismatchException extends RuntimeException {
        public PatchMismatchException(String message) {
            super(message);
        }
    }

    // Which side of the diff the previous body line belonged to; decides
    // what a "\ No newline at end of file" marker refers to.
    private enum Side { OLD, NEW, BOTH }

    /**
     * @param base  Current file content ("" for a file that does not exist yet).
     * @param patch Unified-diff text for that one file.
     * @return the patched content
     * @throws PatchMismatchException if the patch does not apply cleanly
     */
    public static String apply(String base, String patch) {
        return new Run(base, patch).execute();
    }

    // ------------------------------------------------------------------
    // One application: mutable cursor state over the base and the patch
    // ------------------------------------------------------------------

    private static final class Run {

        private final List<String> source;
        private final boolean      sourceEndsWithNewline;
        private final List<String> patchLines;
        private final List<String> out = new ArrayList<>();

        private int     pointer;             // next unconsumed source line (0-based)
        private int     cursor;              // next unread patch line
        private Side    lastSide;
        private boolean touchedEof;
        private boolean newSideLacksNewline;

        Run(String base, String patch) {
            if (base.isEmpty()) {
                this.source = List.of();
                this.sourceEndsWithNewline = false;
            } else {
                List<String> lines = new ArrayList<>(Arrays.asList(base.split("\n", -1)));
                this.sourceEndsWithNewline = lines.get(lines.size() - 1).isEmpty();
                if (sourceEndsWithNewline) {
                    lines.remove(lines.size() - 1);
                }
                this.source = lines;
            }
            String body = patch.endsWith("\n") ? patch.substring(0, patch.length() - 1) : patch;
            this.patchLines = body.isEmpty() ? List.of() : Arrays.asList(body.split("\n", -1));
        }

        String execute() {
            boolean hasHunks = patchLines.stream().anyMatch(l -> l.startsWith("@@"));
            if (hasHunks) {
                applyHunks();
            } else {
                applyImplicitHunk();
            }
            if (pointer == source.size()) {
                touchedEof = true;
            }
            while (pointer < source.size()) {
                out.add(source.get(pointer++));
            }
            return render();
        }

        private void applyHunks() {
            while (cursor < patchLines.size()) {
                String line = patchLines.get(cursor);
                if (!line.startsWith("@@")) {
                    // Outside a hunk only headers and git metadata may appear; a body
                    // line here means the previous hunk header undercounted.
                    if (!isFileHeader(line) && isBodyLine(line)) {
                        throw new PatchMismatchException("Line outside any hunk"
                                + " (hunk header counts too small?): " + line);
                    }
                    cursor++;
                    continue;
                }
                Matcher m = HUNK_HEADER.matcher(line);
                if (!m.matches()) {
                    throw new PatchMismatchException("Malformed hunk header: " + line);
                }
                int oldStart = headerNumber(m.group(1), 1, line);
                int oldCount = headerNumber(m.group(2), 1, line);
                int newCount = headerNumber(m.group(4), 1, line);

                // A zero-length old range names the line *after which* to insert.
                int target = oldCount == 0 ? oldStart : oldStart - 1;
                if (target < pointer) {
                    throw new PatchMismatchException(
                            "Hunk at line " + oldStart + " overlaps or precedes the previous hunk");
                }
                if (target > source.size()) {
                    throw new PatchMismatchException("Hunk starts at line " + oldStart
                            + " but the file has " + source.size() + " lines");
                }
                while (pointer < target) {
                    out.add(source.get(pointer++));
                }
                cursor++;
                applyHunkBody(oldStart, oldCount, newCount);
                if (pointer == source.size()) {
                    touchedEof = true;
                }
            }
        }

        private void applyHunkBody(int oldStart, int oldCount, int newCount) {
            int oldSeen = 0;
            int newSeen = 0;
            while (oldSeen < oldCount || newSeen < newCount) {
                if (cursor >= patchLines.size()) {
                    throw new PatchMismatchException("Hunk at line " + oldStart + " is truncated: expected "
                            + oldCount + " old / " + newCount + " new lines, got "
                            + oldSeen + " / " + newSeen);
                }
                String line = patchLines.get(cursor++);
                if (line.startsWith("\\")) {
                    noNewlineMarker();
                    continue;
                }
                switch (applyBodyLine(line)) {
                    case OLD  -> oldSeen++;
                    case NEW  -> newSeen++;
                    case BOTH -> { oldSeen++; newSeen++; }
                }
            }
            while (cursor < patchLines.size() && patchLines.get(cursor).startsWith("\\")) {
                cursor++;
                noNewlineMarker();
            }
        }

        private void applyImplicitHunk() {
            while (cursor < patchLines.size()) {
                String line = patchLines.get(cursor++);
                if (isFileHeader(line)) continue;
                if (line.startsWith("\\")) {
                    noNewlineMarker();
                    continue;
                }
                applyBodyLine(line);
            }
        }

        private Side applyBodyLine(String line) {
            // Editors often strip the single space from blank context lines.
            char   tag  = line.isEmpty() ? ' ' : line.charAt(0);
            String text = line.isEmpty() ? ""  : line.substring(1);
            switch (tag) {
                case ' ' -> {
                    expect(text);
                    out.add(source.get(pointer++));
                    lastSide = Side.BOTH;
                }
                case '-' -> {
                    expect(text);
                    pointer++;
                    lastSide = Side.OLD;
                }
                case '+' -> {
                    out.add(text);
                    lastSide = Side.NEW;
                }
                default -> throw new PatchMismatchException("Unexpected line in hunk: " + line);
            }
            return lastSide;
        }

        private void expect(String expected) {
            if (pointer >= source.size()) {
                throw new PatchMismatchException("Expected \"" + expected + "\" at line " + (pointer + 1)
                        + " but the file has " + source.size() + " lines");
            }
            String actual = source.get(pointer);
            if (!actual.equals(expected)) {
                throw new PatchMismatchException("Mismatch at line " + (pointer + 1)
                        + ": expected \"" + expected + "\", found \"" + actual + "\"");
            }
        }

        private void noNewlineMarker() {
            if (lastSide == Side.NEW || lastSide == Side.BOTH) {
                newSideLacksNewline = true;
            }
        }

        private String render() {
            if (out.isEmpty()) return "";
            boolean newline;
            if (newSideLacksNewline) {
                newline = false;
            } else {
                newline = sourceEndsWithNewline || source.isEmpty() || touchedEofWithChanges();
            }
            return String.join("\n", out) + (newline ? "\n" : "");
        }

        // A hunk that reached the end of a file lacking a final newline, without
        // a marker saying the new side lacks one too, leaves a terminated file.
        private boolean touchedEofWithChanges() {
            return touchedEof && lastSide != null && lastSide != Side.BOTH;
        }

        private static int headerNumber(String digits, int absent, String header) {
            if (digits == null) return absent;
            try {
                return Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                throw new PatchMismatchException("Hunk header number out of range: " + header);
            }
        }

        private static boolean isBodyLine(String line) {
            return line.startsWith("+") || line.startsWith("-") || line.startsWith(" ");
        }

        private static boolean isFileHeader(String line) {
            return line.startsWith("diff ")
                || line.startsWith("index ")
                || line.equals("---") || line.startsWith("--- ")
                || line.equals("+++") || line.startsWith("+++ ");
        }
    }
}
