package io.neotool.kafka.sample.people.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/** A Star Wars character as published by the people ingestion flow. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PeoplePayload {
  @Nullable private final String name;
  @Nullable private final String height;
  @Nullable private final String mass;
  @Nullable private final String hairColor;
  @Nullable private final String skinColor;
  @Nullable private final String eyeColor;
  @Nullable private final String birthYear;
  @Nullable private final String gender;
  @Nullable private final String homeworldUrl;
  private final ImmutableList<String> films;
  private final ImmutableList<String> species;
  private final ImmutableList<String> vehicles;
  private final ImmutableList<String> starships;

  @JsonCreator
  public PeoplePayload(
      @JsonProperty("name") @Nullable String name,
      @JsonProperty("height") @Nullable String height,
      @JsonProperty("mass") @Nullable String mass,
      @JsonProperty("hair_color") @Nullable String hairColor,
      @JsonProperty("skin_color") @Nullable String skinColor,
      @JsonProperty("eye_color") @Nullable String eyeColor,
      @JsonProperty("birth_year") @Nullable String birthYear,
      @JsonProperty("gender") @Nullable String gender,
      @JsonProperty("homeworld_url") @Nullable String homeworldUrl,
      @JsonProperty("films") @Nullable List<String> films,
      @JsonProperty("species") @Nullable List<String> species,
      @JsonProperty("vehicles") @Nullable List<String> vehicles,
      @JsonProperty("starships") @Nullable List<String> starships) {
    this.name = name;
    this.height = height;
    this.mass = mass;
    this.hairColor = hairColor;
    this.skinColor = skinColor;
    this.eyeColor = eyeColor;
    this.birthYear = birthYear;
    this.gender = gender;
    this.homeworldUrl = homeworldUrl;
    this.films = copyOf(films);
    this.species = copyOf(species);
    this.vehicles = copyOf(vehicles);
    this.starships = copyOf(starships);
  }

  private static ImmutableList<String> copyOf(@Nullable List<String> values) {
    return values == null ? ImmutableList.of() : ImmutableList.copyOf(values);
  }

  @Nullable
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @Nullable
  @JsonProperty("height")
  public String getHeight() {
    return height;
  }

  @Nullable
  @JsonProperty("mass")
  public String getMass() {
    return mass;
  }

  @Nullable
  @JsonProperty("hair_color")
  public String getHairColor() {
    return hairColor;
  }

  @Nullable
  @JsonProperty("skin_color")
  public String getSkinColor() {
    return skinColor;
  }

  @Nullable
  @JsonProperty("eye_color")
  public String getEyeColor() {
    return eyeColor;
  }

  @Nullable
  @JsonProperty("birth_year")
  public String getBirthYear() {
    return birthYear;
  }

  @Nullable
  @JsonProperty("gender")
  public String getGender() {
    return gender;
  }

  @Nullable
  @JsonProperty("homeworld_url")
  public String getHomeworldUrl() {
    return homeworldUrl;
  }

  @JsonProperty("films")
  public List<String> getFilms() {
    return films;
  }

  @JsonProperty("species")
  public List<String> getSpecies() {
    return species;
  }

  @JsonProperty("vehicles")
  public List<String> getVehicles() {
    return vehicles;
  }

  @JsonProperty("starships")
  public List<String> getStarships() {
    return starships;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PeoplePayload that = (PeoplePayload) o;
    return Objects.equals(name, that.name)
        && Objects.equals(height, that.height)
        && Objects.equals(mass, that.mass)
        && Objects.equals(hairColor, that.hairColor)
        && Objects.equals(skinColor, that.skinColor)
        && Objects.equals(eyeColor, that.eyeColor)
        && Objects.equals(birthYear, that.birthYear)
        && Objects.equals(gender, that.gender)
        && Objects.equals(homeworldUrl, that.homeworldUrl)
        && films.equals(that.films)
        && species.equals(that.species)
        && vehicles.equals(that.vehicles)
        && starships.equals(that.starships);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        name,
        height,
        mass,
        hairColor,
        skinColor,
        eyeColor,
        birthYear,
        gender,
        homeworldUrl,
        films,
        species,
        vehicles,
        starships);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("birthYear", birthYear)
        .add("homeworldUrl", homeworldUrl)
        .toString();
  }
}
