package com.example.rental.domain.exception;

import java.time.LocalDate;

public class InvalidRentalDateException extends DomainException {

    private final LocalDate rentalDate;

    public InvalidRentalDateException(LocalDate rentalDate, LocalDate today) {
        super("Rental date " + rentalDate + " is in the past (today is " + today + ")");
        this.rentalDate = rentalDate;
    }

    public LocalDate getRentalDate() {
        return rentalDate;
    }
}
