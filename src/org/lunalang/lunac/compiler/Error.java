
package org.lunalang.lunac.compiler;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

public record Error(String message, Marking... markings) {

    public static record Marking(Type type, Source location, String note) {

        private enum Type {
            ERROR('^', Color.from(Color.RED)),
            INFO('~', Color.from(Color.BRIGHT_BLUE));

            private final char marker;
            private final String color;

            private Type(char marker, String color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.message, Arrays.hashCode(this.markings));
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append(this.message);
        for(Marking marked: this.markings) {
            output.append(" ");
            output.append(marked.location);
        }
        return output.toString();
    }

    private static boolean isWhitespace(char c) {
        return c == '\t' || c == '\n' || c == '\r' || c == ' ';
    }

    public String render(Map<String, String> files, boolean colored) {
        String errorWordColor = colored
            ? Color.from(Color.BOLD, Color.RED) : "";
        String errorMessageColor = colored
            ? Color.from(Color.RED) : "";
        String frameColor = colored
            ? Color.from(Color.GRAY) : "";
        String resetColor = colored
            ? Color.from() : "";
        StringBuilder output = new StringBuilder();
        output.append(errorWordColor);
        output.append("error: ");
        output.append(errorMessageColor);
        output.append(this.message);
        output.append(resetColor);
        output.append("\n");
        for(Marking marked: this.markings) {
            String fileContent = files.get(marked.location.file());
            if(fileContent == null) {
                output.append("  ");
                output.append(frameColor);
                output.append("╭─ ");
                output.append(marked.location.toString());
                output.append(resetColor);
                output.append(" ");
                output.append(marked.note);
                output.append("\n");
                continue;
            }
            int start = Math.min(
                marked.location.startOffset(), fileContent.length()
            );
            int lineStart = fileContent.lastIndexOf('\n', start - 1) + 1;
            int lineEnd = fileContent.indexOf('\n', start);
            if(lineEnd == -1) { lineEnd = fileContent.length(); }
            String line = fileContent.substring(lineStart, lineEnd);
            if(line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            int markEnd = Math.min(
                Math.max(marked.location.endOffset(), start + 1),
                lineStart + line.length()
            );
            String lineNumber = String.valueOf(
                marked.location.computeLine(files)
            );
            final int paddingSpaces = 2;
            String padding = " ".repeat(paddingSpaces + lineNumber.length());
            output.append(padding);
            output.append(frameColor);
            output.append("╭─ ");
            output.append(marked.location.file());
            output.append(":");
            output.append(lineNumber);
            output.append(":");
            output.append(start - lineStart + 1);
            output.append("\n");
            output.append(" ".repeat(paddingSpaces - 1));
            output.append(resetColor);
            output.append(lineNumber);
            output.append(frameColor);
            output.append(" │ ");
            output.append(resetColor);
            output.append(line);
            output.append("\n");
            output.append(frameColor);
            output.append(padding);
            output.append("┊ ");
            StringBuilder markers = new StringBuilder();
            boolean hadMarker = false;
            for(int charI = lineStart; charI < markEnd; charI += 1) {
                char c = line.charAt(charI - lineStart);
                boolean isMarked = charI >= start
                    && (hadMarker || !Error.isWhitespace(c));
                markers.append(isMarked? marked.type.marker : ' ');
                hadMarker |= isMarked;
            }
            if(colored) { output.append(marked.type.color); }
            output.append(markers);
            output.append(" ");
            output.append(marked.note);
            output.append("\n");
            output.append(frameColor);
            output.append(" ".repeat(paddingSpaces + lineNumber.length() - 1));
            output.append("─╯\n");
            output.append(resetColor);
        }
        return output.toString();
    }

}
