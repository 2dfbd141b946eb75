package com.multidb.service.catalog;

import com.multidb.model.QueryTemplate;
import com.multidb.model.SearchType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.multidb.model.QueryTemplate.when;

/**
 * Chinook music store. Column names are PascalCase in this schema.
 */
@Component
public class ChinookCatalog extends AbstractSourceCatalog {

    public static final String SOURCE = "chinook";

    private final List<QueryTemplate> queryTemplates = List.of(
        when(q -> has(q, "album") && has(q, "artist"), """
            SELECT ar.Name as Artist, al.Title as Album
            FROM album al
            JOIN artist ar ON al.ArtistId = ar.ArtistId
            ORDER BY ar.Name, al.Title
            LIMIT 50
            """),
        when(q -> has(q, "album"), """
            SELECT AlbumId, Title
            FROM album
            ORDER BY Title
            LIMIT 50
            """),
        when(q -> has(q, "artist"), """
            SELECT ArtistId, Name
            FROM artist
            ORDER BY Name
            LIMIT 50
            """),
        when(q -> hasAny(q, "track", "song"), """
            SELECT t.Name as Track, al.Title as Album, ar.Name as Artist
            FROM track t
            JOIN album al ON t.AlbumId = al.AlbumId
            JOIN artist ar ON al.ArtistId = ar.ArtistId
            ORDER BY t.Name
            LIMIT 50
            """),
        when(q -> has(q, "customer"), """
            SELECT CustomerId, FirstName, LastName, Email, Country
            FROM customer
            ORDER BY LastName, FirstName
            LIMIT 50
            """),
        when(q -> hasAny(q, "invoice", "sale"), """
            SELECT i.InvoiceId, c.FirstName, c.LastName, i.InvoiceDate, i.Total
            FROM invoice i
            JOIN customer c ON i.CustomerId = c.CustomerId
            ORDER BY i.InvoiceDate DESC
            LIMIT 50
            """),
        when(q -> has(q, "playlist"), """
            SELECT PlaylistId, Name
            FROM playlist
            ORDER BY Name
            LIMIT 50
            """),
        when(q -> has(q, "genre"), """
            SELECT g.Name as Genre, COUNT(t.TrackId) as track_count
            FROM genre g
            LEFT JOIN track t ON t.GenreId = g.GenreId
            GROUP BY g.GenreId, g.Name
            ORDER BY track_count DESC
            LIMIT 50
            """),
        when(q -> has(q, "employee"), """
            SELECT EmployeeId, FirstName, LastName, Title, City, Country
            FROM employee
            ORDER BY LastName, FirstName
            LIMIT 50
            """)
    );

    private final List<QueryTemplate> crossSourceTemplates = List.of(
        when(q -> has(q, "customer") && has(q, "count"),
            "SELECT 'Music Customers' as entity_type, COUNT(*) as count FROM customer"),
        when(q -> hasAny(q, "payment", "revenue"),
            "SELECT 'Music Sales' as source, SUM(Total) as total_revenue FROM invoice"),
        when(q -> has(q, "email"),
            "SELECT DISTINCT Email as email, 'Music Customer' as type FROM customer WHERE Email IS NOT NULL LIMIT 100"),
        when(q -> hasAny(q, "employee", "staff"),
            "SELECT EmployeeId as id, CONCAT(FirstName, ' ', LastName) as name, Title as role FROM employee LIMIT 100")
    );

    private final Map<String, String> entityCounts = new LinkedHashMap<>();

    public ChinookCatalog() {
        searchFragment(SearchType.NAME, """
            SELECT 'Artist' as type, Name as name, NULL as email, ArtistId as id
            FROM artist
            WHERE Name LIKE ?
            UNION ALL
            SELECT 'Customer' as type, CONCAT(FirstName, ' ', LastName) as name,
                   Email as email, CustomerId as id
            FROM customer
            WHERE FirstName LIKE ? OR LastName LIKE ?
            """);
        searchFragment(SearchType.EMAIL, """
            SELECT 'Customer' as type, CONCAT(FirstName, ' ', LastName) as name,
                   Email as email, CustomerId as id
            FROM customer
            WHERE Email LIKE ?
            """);
        searchFragment(SearchType.TITLE, """
            SELECT 'Album' as type, Title as name, NULL as email, AlbumId as id
            FROM album
            WHERE Title LIKE ?
            UNION ALL
            SELECT 'Track' as type, Name as name, NULL as email, TrackId as id
            FROM track
            WHERE Name LIKE ?
            """);

        entityCounts.put("artists", "SELECT COUNT(*) as c FROM artist");
        entityCounts.put("albums", "SELECT COUNT(*) as c FROM album");
        entityCounts.put("tracks", "SELECT COUNT(*) as c FROM track");
        entityCounts.put("customers", "SELECT COUNT(*) as c FROM customer");
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public List<QueryTemplate> queryTemplates() {
        return queryTemplates;
    }

    @Override
    public String helpStatement() {
        return "SELECT 'Chinook Music Store Database. Ask about: albums, artists, tracks, "
            + "customers, invoices, playlists' as info";
    }

    @Override
    public List<QueryTemplate> crossSourceTemplates() {
        return crossSourceTemplates;
    }

    @Override
    public String crossSourceDefault() {
        return """
            SELECT 'Artists' as entity, COUNT(*) as count FROM artist
            UNION ALL
            SELECT 'Albums' as entity, COUNT(*) as count FROM album
            UNION ALL
            SELECT 'Customers' as entity, COUNT(*) as count FROM customer
            """;
    }

    @Override
    public String customerCountStatement() {
        return "SELECT COUNT(*) as count FROM customer";
    }

    @Override
    public String paymentStatement() {
        return "SELECT COUNT(*) as count, SUM(Total) as total FROM invoice";
    }

    @Override
    public Map<String, String> entityCountStatements() {
        return entityCounts;
    }
}
