package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.model.ThumbnailRecord;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import java.util.List;
import java.util.Optional;

public interface ThumbnailRepository {
    void saveThumbnail(ThumbnailRecord thumbnail);

    Optional<ThumbnailRecord> findThumbnail(String videoId, ThumbnailSize size);

    List<ThumbnailRecord> listThumbnails(String videoId);
}
