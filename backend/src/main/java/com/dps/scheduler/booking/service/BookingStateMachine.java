package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.model.BookingState;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide booking state. Only one location may hold a slot at a time and at most
 * one booking ever succeeds; every change goes through the transition methods below.
 */
@Component
public class BookingStateMachine {
    private final AtomicReference<BookingState> state = new AtomicReference<>(BookingState.SCANNING);

    public BookingState state() {
        return state.get();
    }

    /**
     * Claims the hold. Returns false when another location already holds a slot or a booking
     * has already been made, in which case the caller must do nothing.
     */
    public boolean tryBeginHold() {
        return state.compareAndSet(BookingState.SCANNING, BookingState.HOLDING)
            || state.compareAndSet(BookingState.FAILED, BookingState.HOLDING);
    }

    public void markBooked() {
        if (!state.compareAndSet(BookingState.HOLDING, BookingState.BOOKED)) {
            throw new IllegalStateException("Cannot mark booked from state " + state.get());
        }
    }

    public void markFailed() {
        if (!state.compareAndSet(BookingState.HOLDING, BookingState.FAILED)) {
            throw new IllegalStateException("Cannot mark failed from state " + state.get());
        }
    }

    public boolean isInFlight() {
        BookingState current = state.get();
        return current == BookingState.HOLDING || current == BookingState.BOOKED;
    }

    public boolean isBooked() {
        return state.get() == BookingState.BOOKED;
    }
}
