package code.analysis.prompt;

import java.util.List;

public class InvalidTaskRequestException extends RuntimeException {
    private final List<String> errors;

    public InvalidTaskRequestException(List<String> errors) {
        super("Invalid task request: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
