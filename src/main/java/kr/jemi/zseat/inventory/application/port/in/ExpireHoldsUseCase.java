package kr.jemi.zseat.inventory.application.port.in;

public interface ExpireHoldsUseCase {

    int expireOverdueHolds();
}
