package me.go_gradually.phonedesk.infrastructure.caller.persistence.mongo;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface CallerMemoryMongoRepository extends MongoRepository<CallerMemoryDocument, String> {
}
