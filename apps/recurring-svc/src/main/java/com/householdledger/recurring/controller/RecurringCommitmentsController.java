package com.householdledger.recurring.controller;

import com.householdledger.recurring.controller.dto.CommitmentReviewResponseDto;
import com.householdledger.recurring.controller.dto.RecurringCommitmentsResponseDto;
import com.householdledger.recurring.model.CommitmentRegister;
import com.householdledger.recurring.model.DisplayCurrency;
import com.householdledger.recurring.service.RecurringCommitmentService;
import com.householdledger.recurring.web.RequestContextHolder;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/recurring/commitments")
public class RecurringCommitmentsController {

    private final RecurringCommitmentService commitmentService;

    public RecurringCommitmentsController(RecurringCommitmentService commitmentService) {
        this.commitmentService = commitmentService;
    }

    @GetMapping
    public ResponseEntity<RecurringCommitmentsResponseDto> getCommitments(
            @RequestParam(value = "currency", required = false) String currency
    ) {
        Optional<DisplayCurrency> displayCurrency = Optional.ofNullable(currency)
                .filter(value -> !value.isBlank())
                .map(DisplayCurrency::parse);
        CommitmentRegister register = commitmentService.getRegister(displayCurrency);
        var commitments = register.commitments().stream()
                .map(commitment -> new RecurringCommitmentsResponseDto.CommitmentDto(
                        commitment.name(),
                        commitment.annualizedAmount(),
                        commitment.cumulativeAmount(),
                        commitment.topSpend(),
                        commitment.needsReview(),
                        commitment.rowCount()
                ))
                .toList();
        return ResponseEntity.ok(new RecurringCommitmentsResponseDto(
                register.currency().name(),
                register.fxRate(),
                register.totalAnnualized(),
                commitments,
                RequestContextHolder.traceId().orElse(null)
        ));
    }

    @PostMapping("/{name}/review")
    public ResponseEntity<CommitmentReviewResponseDto> toggleReview(@PathVariable("name") String name) {
        var review = commitmentService.toggleReview(name);
        return ResponseEntity.ok(new CommitmentReviewResponseDto(
                review.name(),
                review.needsReview(),
                review.updatedRows(),
                RequestContextHolder.traceId().orElse(null)
        ));
    }
}
