package com.token.sentiment.analytics.repo;

import com.token.sentiment.analytics.model.entity.NetworkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NetworkRepository extends JpaRepository<NetworkEntity, Long> {

    Optional<NetworkEntity> findByName(String name);

    List<NetworkEntity> findByNameIn(Collection<String> names);
}
