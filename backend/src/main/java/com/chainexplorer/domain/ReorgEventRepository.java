package com.chainexplorer.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ReorgEventRepository extends MongoRepository<ReorgEvent, String> {

    List<ReorgEvent> findAllByOrderByDetectedAtDesc(Pageable pageable);
}
