package com.pnl.infrastructure.config;

import com.pnl.domain.port.AssetMetadataResolver;
import com.pnl.domain.service.FeeCalculator;
import com.pnl.domain.service.LedgerFactory;
import com.pnl.domain.service.OptionExpirationSynthesizer;
import com.pnl.domain.service.StrategyClassifier;
import com.pnl.domain.service.UnderlyingOwnershipClassifier;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Produces the framework-free domain services from {@link EngineConfig}
 */
@ApplicationScoped
public class EngineBeans {

    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public FeeCalculator feeCalculator(EngineConfig config) {
        return new FeeCalculator(config.fees().optionPerContract());
    }

    @Produces
    @Singleton
    public LedgerFactory ledgerFactory(FeeCalculator feeCalculator) {
        return new LedgerFactory(feeCalculator);
    }

    @Produces
    @Singleton
    public OptionExpirationSynthesizer optionExpirationSynthesizer(AssetMetadataResolver assetMetadataResolver,
                                                                   LedgerFactory ledgerFactory) {
        return new OptionExpirationSynthesizer(assetMetadataResolver, ledgerFactory);
    }

    @Produces
    @Singleton
    @DefaultBean
    public StrategyClassifier.Factory strategyClassifierFactory(AssetMetadataResolver assetMetadataResolver,
                                                               EngineConfig config) {
        return history -> new UnderlyingOwnershipClassifier(history, assetMetadataResolver, config.zone());
    }
}
