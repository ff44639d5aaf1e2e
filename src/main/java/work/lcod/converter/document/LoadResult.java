package work.lcod.converter.document;

import java.util.Objects;
import java.util.Optional;
import org.w3c.dom.Document;

/**
 * Outcome of {@link DocumentLoader#load(byte[])}: either a parsed tree or a diagnostic.
 */
public record LoadResult(Optional<Document> document, String error) {
    public LoadResult {
        Objects.requireNonNull(document, "document");
        if (document.isEmpty() && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("A failed load must carry an error message.");
        }
    }

    public static LoadResult success(Document document) {
        return new LoadResult(Optional.of(document), null);
    }

    public static LoadResult failure(String error) {
        return new LoadResult(Optional.empty(), error);
    }

    public boolean isSuccess() {
        return document.isPresent();
    }
}
