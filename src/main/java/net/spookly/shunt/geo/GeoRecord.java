package net.spookly.shunt.geo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Geolocation of one IP address as returned by the ipinfo lite API.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode(of = "ip")
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeoRecord {
    @JsonProperty("ip")
    private final String ip;
    @JsonProperty("asn")
    private final String asn;
    @JsonProperty("as_name")
    private final String asName;
    @JsonProperty("as_domain")
    private final String asDomain;
    @JsonProperty("country_code")
    private final String countryCode;
    @JsonProperty("country")
    private final String country;
    @JsonProperty("continent_code")
    private final String continentCode;
    @JsonProperty("continent")
    private final String continent;

    @JsonCreator
    public GeoRecord(@JsonProperty("ip") String ip,
                     @JsonProperty("asn") String asn,
                     @JsonProperty("as_name") String asName,
                     @JsonProperty("as_domain") String asDomain,
                     @JsonProperty("country_code") String countryCode,
                     @JsonProperty("country") String country,
                     @JsonProperty("continent_code") String continentCode,
                     @JsonProperty("continent") String continent) {
        this.ip = ip;
        this.asn = asn;
        this.asName = asName;
        this.asDomain = asDomain;
        this.countryCode = countryCode;
        this.country = country;
        this.continentCode = continentCode;
        this.continent = continent;
    }
}
