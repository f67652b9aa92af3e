package com.conveyal.gtfsnav.error;

/**
 * A failure to interpret one line of navigation input. Each level of the command hierarchy that a failure passes
 * through wraps it with the id or collection it was navigating into, so that the outermost message reads as one
 * nested chain, e.g. "Error interpreting routes command: Error executing command for route 1: Invalid command: x".
 */
public class CommandException extends Exception {

    private static final long serialVersionUID = 1L;

    public final CommandErrorType errorType;
    /** The command text, collection name or entity id this error is about. May be null for pure wrappers. */
    public final String badValue;

    public CommandException(CommandErrorType errorType, String badValue) {
        super(errorType.englishMessage);
        this.errorType = errorType;
        this.badValue = badValue;
    }

    public CommandException(CommandErrorType errorType, String badValue, Exception cause) {
        super(errorType.englishMessage, cause);
        this.errorType = errorType;
        this.badValue = badValue;
    }

    /** Wrap a failure from a deeper level without naming an entity, e.g. a failing routes collection command. */
    public static CommandException wrap(CommandErrorType errorType, Exception cause) {
        return new CommandException(errorType, null, cause);
    }

    /** Walk the cause chain to the innermost CommandException, which names the original problem. */
    public CommandException getRootCommandError() {
        CommandException root = this;
        while (root.getCause() instanceof CommandException) {
            root = (CommandException) root.getCause();
        }
        return root;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(errorType.englishMessage);
        if (getCause() == null) {
            if (badValue != null) sb.append(": ").append(badValue);
            return sb.toString();
        }
        if (badValue != null) sb.append(' ').append(badValue);
        sb.append(": ");
        sb.append(getCause().getMessage());
        return sb.toString();
    }
}
