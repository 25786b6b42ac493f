package org.routecraft.graph;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Built-in demo maps.
 */
@UtilityClass
public final class SampleMaps {

    /**
     * Resets {@code graph} and fills it with a 16-location city, every road a
     * distance-weighted two-way connection.
     *
     * @param graph graph to populate; needs room for 16 nodes and 6 edges per node.
     * @return the same graph.
     */
    public static MapGraph city(MapGraph graph) {
        Objects.requireNonNull(graph, "graph");
        graph.clear();

        int downtown = graph.addNode("Downtown", 600, 360);
        int centralPark = graph.addNode("Central Park", 700, 300);
        int mainStation = graph.addNode("Main Station", 550, 420);
        int cityHall = graph.addNode("City Hall", 650, 380);

        int northGate = graph.addNode("North Gate", 620, 180);
        int university = graph.addNode("University", 720, 200);
        int museum = graph.addNode("Museum", 550, 220);

        int southMall = graph.addNode("South Mall", 600, 520);
        int airport = graph.addNode("Airport", 750, 550);
        int harbor = graph.addNode("Harbor", 480, 550);

        int techPark = graph.addNode("Tech Park", 850, 350);
        int stadium = graph.addNode("Stadium", 880, 450);
        int beach = graph.addNode("Beach", 920, 300);

        int westGardens = graph.addNode("West Gardens", 400, 350);
        int hospital = graph.addNode("Hospital", 380, 280);
        int industrial = graph.addNode("Industrial Zone", 350, 450);

        // central
        graph.connect(downtown, centralPark);
        graph.connect(downtown, mainStation);
        graph.connect(downtown, cityHall);
        graph.connect(centralPark, cityHall);
        graph.connect(mainStation, cityHall);

        // north
        graph.connect(centralPark, northGate);
        graph.connect(centralPark, university);
        graph.connect(northGate, museum);
        graph.connect(northGate, university);
        graph.connect(museum, hospital);

        // south
        graph.connect(mainStation, southMall);
        graph.connect(southMall, airport);
        graph.connect(southMall, harbor);
        graph.connect(airport, stadium);
        graph.connect(harbor, industrial);

        // east
        graph.connect(centralPark, techPark);
        graph.connect(techPark, beach);
        graph.connect(techPark, stadium);
        graph.connect(university, beach);

        // west
        graph.connect(downtown, westGardens);
        graph.connect(westGardens, hospital);
        graph.connect(westGardens, industrial);
        graph.connect(mainStation, industrial);

        // cross links
        graph.connect(museum, downtown);
        graph.connect(cityHall, southMall);
        graph.connect(harbor, mainStation);
        return graph;
    }
}
