package io.github.crudgraph.core.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Errors caused by a mis-declared entity graph or service configuration rather than by request input.
 */
@Getter
@RequiredArgsConstructor
public enum ServerError implements ErrorDescriptor {

    INVALID_PERMISSION_DEFINITION("The service could not process this request."),
    INVALID_UPDATED_AT_HIERARCHY("No association could be found for the source model ({source}) to the target model "
            + "({target}). Check the updatedAtHierarchy on your TimestampsManager."),
    ENTITY_TO_UPDATE_NOT_FOUND("Unable to find entity to update: {id}"),
    UPSERT_DEPTH_EXCEEDED("Nested input for '{entity}' exceeds the maximum upsert depth of {maxDepth}."),
    STORAGE_ALREADY_INITIALIZED("Storage connection was already initialized."),
    STORAGE_NOT_INITIALIZED("Storage connection has not been initialized.");

    private final String messageTemplate;

    @Override
    public String getCode() {
        return name();
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Override
    public String getTitle() {
        return "Internal server error";
    }
}
