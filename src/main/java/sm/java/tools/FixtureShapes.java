package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fixture shaping shared by the fixture list and head-to-head tools.
 */
final class FixtureShapes {

    private FixtureShapes() {
    }

    static void appendFixture(SportsTool tool, ArrayNode target, JsonNode item) {
        JsonNode fixture = item.path("fixture");
        ObjectNode node = target.addObject();
        SportsTool.copy(node, fixture, "id", "referee", "timezone", "date", "timestamp");
        node.set("venue", tool.pick(fixture.get("venue"), "id", "name", "city"));

        ObjectNode status = node.putObject("status");
        SportsTool.copy(status, fixture.path("status"), "long", "short", "elapsed");

        node.set("league", tool.pick(item.get("league"), "id", "name", "country", "logo", "season", "round"));

        ObjectNode teams = node.putObject("teams");
        teams.set("home", tool.pick(item.path("teams").get("home"), "id", "name", "logo", "winner"));
        teams.set("away", tool.pick(item.path("teams").get("away"), "id", "name", "logo", "winner"));

        ObjectNode goals = node.putObject("goals");
        SportsTool.copy(goals, item.path("goals"), "home", "away");

        ObjectNode score = node.putObject("score");
        SportsTool.copy(score, item.path("score"), "halftime", "fulltime", "extratime", "penalty");
    }
}
