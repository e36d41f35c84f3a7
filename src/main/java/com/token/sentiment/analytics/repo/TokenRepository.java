package com.token.sentiment.analytics.repo;

import com.token.sentiment.analytics.model.entity.TokenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TokenRepository extends JpaRepository<TokenEntity, Long> {

    List<TokenEntity> findBySymbol(String symbol);

    List<TokenEntity> findBySymbolAndNetwork_Name(String symbol, String network);

    List<TokenEntity> findBySymbolAndNetworkIsNull(String symbol);

    List<TokenEntity> findBySymbolAndNetwork_NameIn(String symbol, Collection<String> networks);

    List<TokenEntity> findByIdNot(Long id);
}
