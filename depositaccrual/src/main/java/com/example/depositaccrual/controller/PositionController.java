package com.example.depositaccrual.controller;

import com.example.depositaccrual.dto.BookInterestRequestDTO;
import com.example.depositaccrual.dto.PositionRequestDTO;
import com.example.depositaccrual.entity.Position;
import com.example.depositaccrual.service.PositionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for deposit position maintenance
 */
@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
public class PositionController {

    private final PositionService positionService;

    @GetMapping
    public ResponseEntity<List<Position>> getAllPositions() {
        return ResponseEntity.ok(positionService.getAllPositions());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Position> getPosition(@PathVariable String id) {
        return ResponseEntity.ok(positionService.getPosition(id));
    }

    /**
     * Create a new position
     *
     * @param request The position data
     * @return The created position
     */
    @PostMapping
    public ResponseEntity<Position> createPosition(@Valid @RequestBody PositionRequestDTO request) {
        Position created = positionService.createPosition(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Position> updatePosition(@PathVariable String id,
                                                   @Valid @RequestBody PositionRequestDTO request) {
        return ResponseEntity.ok(positionService.updatePosition(id, request));
    }

    /**
     * Set the interest already booked for a position
     *
     * @param id The position id
     * @param request The booked interest amount
     * @return The updated position
     */
    @PutMapping("/{id}/booked-interest")
    public ResponseEntity<Position> bookInterest(@PathVariable String id,
                                                 @Valid @RequestBody BookInterestRequestDTO request) {
        return ResponseEntity.ok(positionService.bookInterest(id, request.getBookedInterest()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePosition(@PathVariable String id) {
        positionService.deletePosition(id);
        return ResponseEntity.noContent().build();
    }
}
