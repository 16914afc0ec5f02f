package com.example.kiosksync.repo;

import com.example.kiosksync.model.StoredObject;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface StoredObjectRepo extends MongoRepository<StoredObject, String> {}
