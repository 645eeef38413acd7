package sokoban.client;

/**
 * Thrown when puzzle text cannot be turned into a board: no rows at all,
 * or a number of agent markers other than one.
 */
public class MalformedBoardException extends IllegalArgumentException {

    public MalformedBoardException(String message) {
        super(message);
    }
}
