package com.ordersaga.inventory.service;

public record ReservationOutcome(Status status, int remainingStock) {

    public enum Status {
        RESERVED("reserved"),
        UNKNOWN_PRODUCT("product_not_found"),
        INSUFFICIENT_STOCK("insufficient_stock"),
        INVALID_QUANTITY("invalid_quantity"),
        CONFLICT_EXHAUSTED("concurrent_update_conflict");

        private final String reason;

        Status(String reason) {
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    public static ReservationOutcome reserved(int remainingStock) {
        return new ReservationOutcome(Status.RESERVED, remainingStock);
    }

    public static ReservationOutcome rejected(Status status, int currentStock) {
        return new ReservationOutcome(status, currentStock);
    }

    public boolean isReserved() {
        return status == Status.RESERVED;
    }
}
