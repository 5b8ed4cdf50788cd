package io.github.drompincen.habitnotifier.persistence.repository;

import io.github.drompincen.habitnotifier.persistence.document.UserDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface UserRepository extends MongoRepository<UserDocument, Long> {
}
