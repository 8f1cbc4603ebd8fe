package com.flagship.card_autopay.card;

import com.flagship.card_autopay.common.exception.StaleWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed {@link CardStore}. Bridges the {@link Card} domain object and {@link CardEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardPersistenceService implements CardStore {

    private final CardRepository cardRepository;

    @Override
    @Transactional
    public Card insert(Card card) {
        CardEntity saved = cardRepository.saveAndFlush(CardEntity.fromDomain(card));
        log.debug("Inserted card {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public Card update(Card card) {
        CardEntity existing = cardRepository.findById(card.getId())
            .orElseThrow(() -> new CardNotFoundException(card.getId()));

        if (!Objects.equals(existing.getVersion(), card.getVersion())) {
            throw new StaleWriteException("Card", card.getId(), card.getVersion(), existing.getVersion());
        }

        existing.updateFromDomain(card);
        CardEntity updated = cardRepository.saveAndFlush(existing);
        log.debug("Updated card {} to version {}", updated.getId(), updated.getVersion());
        return updated.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findById(UUID cardId) {
        return cardRepository.findById(cardId).map(CardEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> findAll() {
        return cardRepository.findAllByOrderByCreatedAtAsc().stream()
            .map(CardEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> findByConnectionStatus(ConnectionStatus status) {
        return cardRepository.findByConnectionStatus(status).stream()
            .map(CardEntity::toDomain)
            .toList();
    }
}
