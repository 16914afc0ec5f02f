package com.example.kiosksync.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.example.kiosksync.model.StoredObject;
import com.example.kiosksync.repo.StoredObjectRepo;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Component
public class MongoObjectStore implements ObjectStore {

    private final MongoTemplate mongo;
    private final StoredObjectRepo repo;

    @Autowired
    public MongoObjectStore(MongoTemplate mongo, StoredObjectRepo repo) {
        this.mongo = mongo;
        this.repo = repo;
    }

    @Override
    public Optional<StoredObject> get(String key) {
        return repo.findById(key);
    }

    @Override
    public boolean exists(String key) {
        return repo.existsById(key);
    }

    @Override
    public long put(String key, byte[] body, String contentType) {
        StoredObject saved = mongo.findAndModify(
                new Query(where("_id").is(key)),
                contentUpdate(body, contentType),
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                StoredObject.class);
        return saved == null ? 1L : saved.getRevision();
    }

    @Override
    public long putIfRevision(String key, byte[] body, String contentType, long expectedRevision) {
        if (expectedRevision <= 0) {
            try {
                mongo.insert(StoredObject.builder()
                        .key(key)
                        .body(body)
                        .contentType(contentType)
                        .revision(1L)
                        .size(body.length)
                        .lastModified(Instant.now())
                        .build());
                return 1L;
            } catch (DuplicateKeyException e) {
                throw new RevisionConflictException(key, expectedRevision);
            }
        }
        Query q = new Query(where("_id").is(key).and("revision").is(expectedRevision));
        UpdateResult result = mongo.updateFirst(q, contentUpdate(body, contentType), StoredObject.class);
        if (result.getMatchedCount() == 0) {
            throw new RevisionConflictException(key, expectedRevision);
        }
        return expectedRevision + 1;
    }

    @Override
    public boolean delete(String key) {
        return mongo.remove(new Query(where("_id").is(key)), StoredObject.class).getDeletedCount() > 0;
    }

    @Override
    public List<String> list(String prefix) {
        Query q = new Query(where("_id").regex("^" + Pattern.quote(prefix)));
        q.fields().include("_id");
        List<Document> docs = mongo.find(q, Document.class, mongo.getCollectionName(StoredObject.class));
        return docs.stream().map(d -> d.getString("_id")).sorted().collect(Collectors.toList());
    }

    private Update contentUpdate(byte[] body, String contentType) {
        return new Update()
                .set("body", body)
                .set("contentType", contentType)
                .set("size", (long) body.length)
                .set("lastModified", Instant.now())
                .inc("revision", 1L);
    }
}
