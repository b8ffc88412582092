package com.flagship.token_ledger.api;

import com.flagship.token_ledger.airdrop.AirdropReceipt;
import com.flagship.token_ledger.airdrop.AirdropService;
import com.flagship.token_ledger.api.dto.AirdropRequest;
import com.flagship.token_ledger.api.dto.AirdropResponse;
import com.flagship.token_ledger.api.dto.BalanceResponse;
import com.flagship.token_ledger.api.dto.BurnRequest;
import com.flagship.token_ledger.api.dto.FeaturesRequest;
import com.flagship.token_ledger.api.dto.FeaturesResponse;
import com.flagship.token_ledger.api.dto.InitializeRequest;
import com.flagship.token_ledger.api.dto.MetadataResponse;
import com.flagship.token_ledger.api.dto.MintRequest;
import com.flagship.token_ledger.api.dto.TransferRequest;
import com.flagship.token_ledger.api.dto.TransferResponse;
import com.flagship.token_ledger.api.dto.WhitelistResponse;
import com.flagship.token_ledger.api.dto.WhitelistStatusResponse;
import com.flagship.token_ledger.api.dto.WhitelistUpdateRequest;
import com.flagship.token_ledger.asset.Asset;
import com.flagship.token_ledger.asset.AssetRegistry;
import com.flagship.token_ledger.feature.FeatureService;
import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.LedgerService;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.whitelist.WhitelistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for the token ledger.
 *
 * Privileged endpoints identify the caller by the X-Caller-Address header. The header is
 * set by the authenticating gateway in front of this service and is trusted as-is.
 * Balance and metadata reads are public.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String CALLER_HEADER = CorrelationContext.CALLER_ADDRESS_HEADER;

    private final AssetRegistry assetRegistry;
    private final FeatureService featureService;
    private final WhitelistService whitelistService;
    private final LedgerService ledgerService;
    private final AirdropService airdropService;

    @PostMapping("/initialize")
    public ResponseEntity<MetadataResponse> initialize(@Valid @RequestBody InitializeRequest request) {
        Asset asset = assetRegistry.initialize(Address.of(request.getAdmin()));
        return ResponseEntity.status(HttpStatus.CREATED).body(MetadataResponse.from(asset, false));
    }

    @GetMapping("/metadata")
    public ResponseEntity<MetadataResponse> getMetadata() {
        Asset asset = assetRegistry.getMetadata();
        boolean paused = assetRegistry.requireState().getFeatureFlags().current().isPaused();
        return ResponseEntity.ok(MetadataResponse.from(asset, paused));
    }

    @GetMapping("/features")
    public ResponseEntity<FeaturesResponse> getFeatures(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(FeaturesResponse.from(featureService.getFeatures(Address.of(caller))));
    }

    @PutMapping("/features")
    public ResponseEntity<FeaturesResponse> setFeatures(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody FeaturesRequest request) {
        FeatureState state = featureService.setFeatures(
            Address.of(caller), request.getAirdropEnabled(), request.getWhitelistEnabled());
        return ResponseEntity.ok(FeaturesResponse.from(state));
    }

    @GetMapping("/whitelist")
    public ResponseEntity<WhitelistResponse> listWhitelist(@RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(WhitelistResponse.of(whitelistService.listMembers(Address.of(caller))));
    }

    @GetMapping("/whitelist/{address}")
    public ResponseEntity<WhitelistStatusResponse> isWhitelisted(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable("address") String address) {
        Address member = Address.of(address);
        boolean whitelisted = whitelistService.isWhitelisted(Address.of(caller), member);
        return ResponseEntity.ok(WhitelistStatusResponse.builder()
            .address(member.getValue())
            .whitelisted(whitelisted)
            .build());
    }

    @PostMapping("/whitelist")
    public ResponseEntity<WhitelistResponse> updateWhitelist(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody WhitelistUpdateRequest request) {
        int members = whitelistService.updateWhitelist(
            Address.of(caller), toAddresses(request.getAddresses()), request.getAdd());
        return ResponseEntity.ok(WhitelistResponse.builder().memberCount(members).build());
    }

    @PostMapping("/mint")
    public ResponseEntity<BalanceResponse> mint(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody MintRequest request) {
        Address to = Address.of(request.getTo());
        long balance = ledgerService.mint(Address.of(caller), to, request.getAmount());
        return ResponseEntity.ok(balance(to, balance));
    }

    @PostMapping("/transfer")
    public ResponseEntity<TransferResponse> transfer(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody TransferRequest request) {
        Address from = Address.of(request.getFrom());
        Address to = Address.of(request.getTo());
        ledgerService.transfer(Address.of(caller), from, to, request.getAmount());
        return ResponseEntity.ok(TransferResponse.builder()
            .from(balance(from, ledgerService.getBalance(from)))
            .to(balance(to, ledgerService.getBalance(to)))
            .build());
    }

    @PostMapping("/burn")
    public ResponseEntity<BalanceResponse> burn(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody BurnRequest request) {
        Address from = Address.of(request.getFrom());
        long balance = ledgerService.burn(Address.of(caller), from, request.getAmount());
        return ResponseEntity.ok(balance(from, balance));
    }

    @PostMapping("/airdrop")
    public ResponseEntity<AirdropResponse> airdrop(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody AirdropRequest request) {
        log.info("Received airdrop request: recipients={}", request.getRecipients().size());
        AirdropReceipt receipt = airdropService.airdrop(
            Address.of(caller), toAddresses(request.getRecipients()), request.getAmounts());
        return ResponseEntity.ok(AirdropResponse.from(receipt));
    }

    @GetMapping("/balances/{address}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("address") String address) {
        Address holder = Address.of(address);
        return ResponseEntity.ok(balance(holder, ledgerService.getBalance(holder)));
    }

    private static BalanceResponse balance(Address holder, long balance) {
        return BalanceResponse.builder()
            .address(holder.getValue())
            .balance(balance)
            .build();
    }

    private static List<Address> toAddresses(List<String> values) {
        return values.stream().map(Address::of).toList();
    }
}
