package org.javai.pdx.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.javai.pdx.modifier.DiscoveredEntities;
import org.javai.pdx.script.PdxGrammar;
import org.javai.pdx.script.PdxParser;
import org.javai.pdx.script.PdxSchemaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Entity discovery")
class EntityDiscoveryTest {

	@TempDir
	Path root;

	private final EntityDiscovery discovery =
			new EntityDiscovery(new PdxParser(PdxGrammar.standard()), StandardCharsets.ISO_8859_1);

	private Path write(String relative, String content) throws IOException {
		Path file = root.resolve(relative);
		Files.createDirectories(file.getParent());
		Files.writeString(file, content, StandardCharsets.ISO_8859_1);
		return file;
	}

	@Test
	@DisplayName("Should strip the estate prefix from top-level estate keys")
	void shouldLoadEstates() throws Exception {
		write("estates/00_estates.txt", """
				estate_church = { icon = 1 }
				estate_nobles = { icon = 2 }
				""");
		write("estates/01_more.txt", "cossacks = { icon = 3 }");

		Set<String> estates = discovery.loadEstates(List.of(root.resolve("estates")));

		assertThat(estates).containsExactly("church", "cossacks", "nobles");
	}

	@Test
	@DisplayName("Should load factions except ignored ones")
	void shouldLoadFactions() throws Exception {
		write("factions/00_factions.txt", """
				mr_traders = { monarch_power = adm }
				mr_guilds = { monarch_power = dip }
				temples = { monarch_power = mil }
				""");

		Set<String> factions = discovery.loadFactions(List.of(root.resolve("factions")), Set.of("temples"));

		assertThat(factions).containsExactly("mr_guilds", "mr_traders");
	}

	@Test
	@DisplayName("Should collect the keys of the first powers block of each mechanic")
	void shouldLoadGovernmentPowers() throws Exception {
		write("mechanics/00_mechanics.txt", """
				hre_mechanic = {
					available = { always = yes }
					powers = {
						imperial_authority = { max = 100 }
						reform_progress = { max = 1000 }
					}
					powers = {
						ignored_power = { max = 1 }
					}
				}
				plain_mechanic = {
					available = { always = no }
				}
				""");

		Set<String> powers = discovery.loadGovernmentPowers(List.of(root.resolve("mechanics")));

		assertThat(powers).containsExactly("imperial_authority", "reform_progress");
	}

	@Test
	@DisplayName("Should bundle everything with the configured tech types")
	void shouldDiscoverAll() throws Exception {
		write("estates/e.txt", "estate_burghers = { }");
		write("factions/f.txt", "rr_jacobins = { }");
		write("mechanics/m.txt", "mech = { powers = { devotion_power = { } } }");

		DiscoveredEntities entities = discovery.discover(
				List.of(root.resolve("estates")),
				List.of(root.resolve("factions")),
				List.of(),
				List.of(root.resolve("mechanics")),
				List.of("mil", "adm"));

		assertThat(entities.estates()).containsExactly("burghers");
		assertThat(entities.factions()).containsExactly("rr_jacobins");
		assertThat(entities.governmentPowers()).containsExactly("devotion_power");
		assertThat(entities.techTypes()).containsExactly("adm", "mil");
	}

	@Test
	@DisplayName("Should reject an estate file whose entries are not blocks")
	void shouldRejectMalformedEstate() throws Exception {
		write("estates/bad.txt", "estate_church = yes");

		assertThatThrownBy(() -> discovery.loadEstates(List.of(root.resolve("estates"))))
				.isInstanceOf(PdxSchemaException.class)
				.hasMessageContaining("estate_church")
				.hasMessageContaining("bad.txt");
	}

	@Test
	@DisplayName("Should reject a powers entry that is not a block")
	void shouldRejectMalformedPowers() throws Exception {
		write("mechanics/bad.txt", "mech = { powers = none }");

		assertThatThrownBy(() -> discovery.loadGovernmentPowers(List.of(root.resolve("mechanics"))))
				.isInstanceOf(PdxSchemaException.class)
				.hasMessageContaining("powers");
	}
}
