package com.example.depositaccrual.service;

import com.example.depositaccrual.dto.PositionRequestDTO;
import com.example.depositaccrual.entity.DayCountConvention;
import com.example.depositaccrual.entity.Position;
import com.example.depositaccrual.exception.ResourceNotFoundException;
import com.example.depositaccrual.repository.PositionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Service for maintaining deposit positions
 */
@Service
@Slf4j
public class PositionService {

    private final PositionRepository positionRepository;
    private final DayCountConvention defaultConvention;

    public PositionService(PositionRepository positionRepository,
                           @Value("${accrual.default-convention:ACTUAL_ACTUAL}") DayCountConvention defaultConvention) {
        this.positionRepository = positionRepository;
        this.defaultConvention = defaultConvention;
    }

    public List<Position> getAllPositions() {
        return positionRepository.findAll();
    }

    /**
     * Get a position by id
     *
     * @param id The position id
     * @return The position
     * @throws ResourceNotFoundException if no position has this id
     */
    public Position getPosition(String id) {
        return positionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Position", "id", id));
    }

    /**
     * Create a new position.
     * A term ending before it starts is accepted; such a position accrues no interest.
     *
     * @param request The position data
     * @return The stored position with its new id
     */
    public Position createPosition(PositionRequestDTO request) {
        Position position = applyRequest(Position.builder(), request).build();
        warnOnInvertedTerm(position);

        Position saved = positionRepository.save(position);
        log.info("Created position {} for bank {}, account {}: nominal={}, rate={}%, term {} - {}, convention={}",
                saved.getId(), saved.getBankName(), saved.getAccountNumber(), saved.getNominal(),
                saved.getAnnualRatePercent(), saved.getStartDate(), saved.getEndDate(), saved.getDayCountConvention());
        return saved;
    }

    /**
     * Replace the data of an existing position
     *
     * @param id The position id
     * @param request The new position data
     * @return The updated position
     * @throws ResourceNotFoundException if no position has this id
     */
    public Position updatePosition(String id, PositionRequestDTO request) {
        Position existing = getPosition(id);
        Position.PositionBuilder builder = applyRequest(existing.toBuilder(), request);
        if (request.getBookedInterest() == null) {
            builder.bookedInterest(existing.getBookedInterest());
        }
        Position position = builder.build();
        warnOnInvertedTerm(position);

        Position saved = positionRepository.save(position);
        log.info("Updated position {} (account {})", saved.getId(), saved.getAccountNumber());
        return saved;
    }

    /**
     * Record the interest already booked for a position, replacing the previous figure
     *
     * @param id The position id
     * @param bookedInterest The booked interest amount
     * @return The updated position
     * @throws ResourceNotFoundException if no position has this id
     */
    public Position bookInterest(String id, BigDecimal bookedInterest) {
        Position position = getPosition(id);
        BigDecimal previous = position.getBookedInterest();
        position.setBookedInterest(bookedInterest);

        Position saved = positionRepository.save(position);
        log.info("Booked interest of position {} changed from {} to {}", id, previous, bookedInterest);
        return saved;
    }

    /**
     * Delete a position
     *
     * @param id The position id
     * @throws ResourceNotFoundException if no position has this id
     */
    public void deletePosition(String id) {
        if (!positionRepository.deleteById(id)) {
            throw new ResourceNotFoundException("Position", "id", id);
        }
        log.info("Deleted position {}", id);
    }

    private Position.PositionBuilder applyRequest(Position.PositionBuilder builder, PositionRequestDTO request) {
        return builder
                .bankName(request.getBankName().trim())
                .accountNumber(request.getAccountNumber().trim())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .nominal(request.getNominal())
                .annualRatePercent(request.getAnnualRatePercent())
                .dayCountConvention(request.getDayCountConvention() != null
                        ? request.getDayCountConvention()
                        : defaultConvention)
                .bookedInterest(request.getBookedInterest() != null
                        ? request.getBookedInterest()
                        : BigDecimal.ZERO);
    }

    private void warnOnInvertedTerm(Position position) {
        if (position.getEndDate().isBefore(position.getStartDate())) {
            log.warn("Position for account {} ends ({}) before it starts ({}); it will accrue no interest",
                    position.getAccountNumber(), position.getEndDate(), position.getStartDate());
        }
    }
}
