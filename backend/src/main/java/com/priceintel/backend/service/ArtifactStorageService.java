package com.priceintel.backend.service;

import com.mongodb.MongoException;
import com.mongodb.client.gridfs.GridFSBucket;
import com.priceintel.backend.exception.UploadFailedException;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsResource;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * GridFS-backed storage for submitted product images.
 */
@Service
public class ArtifactStorageService {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStorageService.class);

    private final GridFsTemplate gridFsTemplate;
    private final GridFSBucket gridFSBucket;

    public ArtifactStorageService(GridFsTemplate gridFsTemplate, GridFSBucket gridFSBucket) {
        this.gridFsTemplate = gridFsTemplate;
        this.gridFSBucket = gridFSBucket;
    }

    /**
     * Store an uploaded image.
     *
     * @throws UploadFailedException when the bytes cannot be read or written
     */
    public ArtifactRef store(MultipartFile file) {
        Document metadata = new Document();
        metadata.put("contentType", file.getContentType());
        metadata.put("originalFilename", file.getOriginalFilename());

        try (InputStream content = file.getInputStream()) {
            ObjectId fileId = gridFsTemplate.store(
                    content,
                    file.getOriginalFilename(),
                    file.getContentType(),
                    metadata);

            String id = fileId.toString();
            log.info("[STORAGE] Stored artifact: {} | Name: {} | Size: {}",
                    id, file.getOriginalFilename(), file.getSize());
            return new ArtifactRef(id, getFileUrl(id), file.getOriginalFilename(), file.getContentType());
        } catch (IOException | DataAccessException | MongoException e) {
            log.error("[STORAGE] Failed to store artifact: {}", file.getOriginalFilename(), e);
            throw new UploadFailedException("Failed to store image: " + e.getMessage(), e);
        }
    }

    /**
     * Find a stored artifact. Unknown or malformed ids yield empty.
     */
    public Optional<GridFsResource> find(String fileId) {
        if (!ObjectId.isValid(fileId)) {
            return Optional.empty();
        }
        var file = gridFsTemplate.findOne(new Query(Criteria.where("_id").is(new ObjectId(fileId))));
        return file == null ? Optional.empty() : Optional.of(gridFsTemplate.getResource(file));
    }

    public void delete(String fileId) {
        gridFSBucket.delete(new ObjectId(fileId));
        log.info("[STORAGE] Deleted artifact: {}", fileId);
    }

    /**
     * Download path served by the file controller.
     */
    public String getFileUrl(String fileId) {
        return "/api/files/" + fileId;
    }

    public record ArtifactRef(String id, String url, String originalFilename, String contentType) {
    }
}
