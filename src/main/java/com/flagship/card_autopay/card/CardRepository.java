package com.flagship.card_autopay.card;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, UUID> {

    List<CardEntity> findByConnectionStatus(ConnectionStatus connectionStatus);

    List<CardEntity> findAllByOrderByCreatedAtAsc();
}
