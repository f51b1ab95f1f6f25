package ai.docsite.bridge.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Line-oriented view of a host document that remembers each line's own terminator, so rendering
 * an unmodified document reproduces the original text byte for byte.
 */
public final class DocumentLines {

    private static final String LF = "\n";
    private static final String CRLF = "\r\n";

    private final List<String> texts;
    private final List<String> terminators;
    private final String lineSeparator;

    private DocumentLines(List<String> texts, List<String> terminators, String lineSeparator) {
        this.texts = texts;
        this.terminators = terminators;
        this.lineSeparator = lineSeparator;
    }

    public static DocumentLines empty() {
        return new DocumentLines(List.of(), List.of(), LF);
    }

    public static DocumentLines parse(String text) {
        Objects.requireNonNull(text, "text");
        List<String> texts = new ArrayList<>();
        List<String> terminators = new ArrayList<>();
        int crlf = 0;
        int lf = 0;
        int lineStart = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != '\n') {
                continue;
            }
            if (i > lineStart && text.charAt(i - 1) == '\r') {
                texts.add(text.substring(lineStart, i - 1));
                terminators.add(CRLF);
                crlf++;
            } else {
                texts.add(text.substring(lineStart, i));
                terminators.add(LF);
                lf++;
            }
            lineStart = i + 1;
        }
        if (lineStart < text.length()) {
            texts.add(text.substring(lineStart));
            terminators.add("");
        }
        String separator = crlf > lf ? CRLF : LF;
        return new DocumentLines(Collections.unmodifiableList(texts), Collections.unmodifiableList(terminators), separator);
    }

    public int size() {
        return texts.size();
    }

    public boolean isEmpty() {
        return texts.isEmpty();
    }

    public String line(int index) {
        return texts.get(index);
    }

    public List<String> lines() {
        return texts;
    }

    public String lineSeparator() {
        return lineSeparator;
    }

    public boolean isBlank(int index) {
        return texts.get(index).isBlank();
    }

    public boolean endsWithBlankLine() {
        return !texts.isEmpty() && isBlank(texts.size() - 1);
    }

    /**
     * Joins the lines in {@code [from, to)} with {@code \n}, without a trailing newline.
     */
    public String join(int from, int to) {
        return String.join(LF, texts.subList(from, to));
    }

    /**
     * Returns a copy in which lines {@code [from, to)} are replaced by {@code replacement}.
     * Replacement lines use the document's dominant separator.
     */
    public DocumentLines replace(int from, int to, List<String> replacement) {
        if (from < 0 || to < from || to > texts.size()) {
            throw new IndexOutOfBoundsException("Invalid line range [" + from + ", " + to + ") for " + texts.size() + " lines");
        }
        List<String> newTexts = new ArrayList<>(texts.size() - (to - from) + replacement.size());
        List<String> newTerminators = new ArrayList<>(newTexts.size());
        newTexts.addAll(texts.subList(0, from));
        newTerminators.addAll(terminators.subList(0, from));
        if (from == texts.size() && from > 0 && terminators.get(from - 1).isEmpty() && !replacement.isEmpty()) {
            newTerminators.set(from - 1, lineSeparator);
        }
        boolean replacesUnterminatedTail = to == texts.size() && to > from && terminators.get(to - 1).isEmpty();
        for (int i = 0; i < replacement.size(); i++) {
            newTexts.add(replacement.get(i));
            boolean last = i == replacement.size() - 1;
            newTerminators.add(last && replacesUnterminatedTail ? "" : lineSeparator);
        }
        newTexts.addAll(texts.subList(to, texts.size()));
        newTerminators.addAll(terminators.subList(to, terminators.size()));
        return new DocumentLines(Collections.unmodifiableList(newTexts), Collections.unmodifiableList(newTerminators), lineSeparator);
    }

    public DocumentLines insert(int at, List<String> newLines) {
        return replace(at, at, newLines);
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < texts.size(); i++) {
            builder.append(texts.get(i)).append(terminators.get(i));
        }
        return builder.toString();
    }
}
