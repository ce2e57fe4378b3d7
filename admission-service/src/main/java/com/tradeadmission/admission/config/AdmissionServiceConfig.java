package com.tradeadmission.admission.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradeadmission.common.admission.AdmissionConfig;
import com.tradeadmission.common.admission.AdmissionController;
import com.tradeadmission.common.admission.AdmissionProfile;
import com.tradeadmission.common.scoring.CandidateScorer;
import com.tradeadmission.common.weighting.RegimeWeightTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the pure admission components from {@code application.yml}.
 *
 * <p>{@code admission.profile} selects the base limits; any override left unset keeps
 * the profile's value. Out-of-range values fail startup with an
 * {@link com.tradeadmission.common.exception.AdmissionConfigException}.
 */
@Configuration
public class AdmissionServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceConfig.class);

    @Value("${admission.profile:bootstrap}")
    private String profileName;

    @Value("${admission.capacity:#{null}}")
    private Integer capacity;

    @Value("${admission.max-new-positions-per-cycle:#{null}}")
    private Integer maxNewPositionsPerCycle;

    @Value("${admission.score-floor:#{null}}")
    private Double scoreFloor;

    @Value("${admission.ev-floor:#{null}}")
    private Double evFloor;

    @Value("${admission.cooldown-minutes:#{null}}")
    private Long cooldownMinutes;

    @Value("${admission.displacement.margin:#{null}}")
    private Double displacementMargin;

    @Value("${admission.displacement.enabled:true}")
    private boolean displacementEnabled;

    @Value("${admission.displacement.min-hold-minutes:0}")
    private long displacementMinHoldMinutes;

    @Value("${admission.displacement.emergency-score:3.0}")
    private double displacementEmergencyScore;

    @Value("${admission.weights.boost:1.5}")
    private double regimeBoost;

    @Value("${admission.weights.damp:0.5}")
    private double regimeDamp;

    @Bean
    public AdmissionProfile admissionProfile() {
        return AdmissionProfile.fromName(profileName);
    }

    @Bean
    public AdmissionConfig admissionConfig(AdmissionProfile profile) {
        AdmissionConfig base = profile.toConfig();
        AdmissionConfig config = new AdmissionConfig(
            capacity                != null ? capacity                : base.capacity(),
            maxNewPositionsPerCycle != null ? maxNewPositionsPerCycle : base.maxNewPositionsPerCycle(),
            scoreFloor              != null ? scoreFloor              : base.scoreFloor(),
            evFloor                 != null ? evFloor                 : base.evFloor(),
            cooldownMinutes         != null ? Duration.ofMinutes(cooldownMinutes) : base.cooldownDuration(),
            displacementMargin      != null ? displacementMargin      : base.displacementMargin(),
            displacementEnabled,
            Duration.ofMinutes(displacementMinHoldMinutes),
            displacementEmergencyScore);
        log.info("Admission config loaded. profile={} capacity={} maxNewPerCycle={} scoreFloor={} evFloor={} "
                 + "cooldown={} displacementEnabled={} margin={}",
                 profile, config.capacity(), config.maxNewPositionsPerCycle(), config.scoreFloor(),
                 config.evFloor(), config.cooldownDuration(), config.displacementEnabled(),
                 config.displacementMargin());
        return config;
    }

    @Bean
    public RegimeWeightTable regimeWeightTable() {
        return new RegimeWeightTable(RegimeWeightTable.BASE_WEIGHTS, regimeBoost, regimeDamp);
    }

    @Bean
    public CandidateScorer candidateScorer(RegimeWeightTable regimeWeightTable) {
        return new CandidateScorer(regimeWeightTable);
    }

    @Bean
    public AdmissionController admissionController(AdmissionConfig admissionConfig) {
        return new AdmissionController(admissionConfig);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
