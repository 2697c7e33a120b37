package com.neuroshield.api.dto;

public record VoterStatsResponse(String address, int accuracy, int participation) {
}
