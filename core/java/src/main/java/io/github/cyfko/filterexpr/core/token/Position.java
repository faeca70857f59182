package io.github.cyfko.filterexpr.core.token;

/**
 * A 1-based (line, column) location in the source text.
 * <p>
 * {@link #NO_POSITION} (0,0) marks synthetic nodes built without source text, as well as the
 * collapsed ends of error and end-of-input tokens.
 * </p>
 *
 * @param line   1-based line number, 0 for {@link #NO_POSITION}
 * @param column 1-based column number, 0 for {@link #NO_POSITION}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Position(int line, int column) implements Comparable<Position> {

    public static final Position NO_POSITION = new Position(0, 0);

    public Position {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Position components must not be negative: " + line + ":" + column);
        }
    }

    /**
     * Position of the first character of a source text.
     *
     * @return position (1,1)
     */
    public static Position start() {
        return new Position(1, 1);
    }

    public boolean isValid() {
        return line > 0 && column > 0;
    }

    public Position nextColumn() {
        return new Position(line, column + 1);
    }

    public Position nextLine() {
        return new Position(line + 1, 1);
    }

    @Override
    public int compareTo(Position other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
