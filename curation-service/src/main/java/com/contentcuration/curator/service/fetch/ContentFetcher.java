package com.contentcuration.curator.service.fetch;

import com.contentcuration.curator.dto.FetchRequest;
import com.contentcuration.curator.dto.FetchedItem;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;

import java.util.List;

/**
 * Fetch collaborator for one source variant.
 *
 * <p>Implementations may return fewer items than requested, or none. A timeout surfaces as
 * {@link com.contentcuration.curator.exception.CollaboratorTimeoutException}.
 */
public interface ContentFetcher {

    SourceType supportedType();

    List<FetchedItem> fetch(Source source, FetchRequest request);
}
