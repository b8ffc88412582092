package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.Address;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Whitelist size, and the members themselves when listing.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WhitelistResponse {

    @JsonProperty("member_count")
    int memberCount;

    @JsonProperty("members")
    List<String> members;

    public static WhitelistResponse of(List<Address> members) {
        return WhitelistResponse.builder()
            .memberCount(members.size())
            .members(members.stream().map(Address::getValue).toList())
            .build();
    }
}
