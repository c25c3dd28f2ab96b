package org.drinkmap.node.processes.http.api.store;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.drinkmap.node.processes.http.AbstractController;
import org.drinkmap.node.processes.http.api.dto.DataResponseDto;
import org.drinkmap.node.spi.ServiceRegistry;
import org.drinkmap.service.StoreService;
import org.drinkmap.service.dto.DrinkSearchRequest;

/**
 * Store, drink and catalog listings.
 * <ul>
 *   <li>{@code POST list/store}: stores with their (matching) menus</li>
 *   <li>{@code POST list/drink?limit=n}: drinks with store fields</li>
 *   <li>{@code POST list/drink/simplified?limit=n}: drinks reduced to display fields</li>
 *   <li>{@code GET list/company}, {@code list/brand}, {@code list/drink_tag}: catalogs</li>
 * </ul>
 * Every response is wrapped as {@code {"data": [...]}}.
 */
public class StoreController extends AbstractController {

    private final StoreService storeService;
    private final Integer defaultLimit;

    /**
     * @param registry Must provide the {@link StoreService}.
     * @param options  Optional {@code default-limit} for drink listings without a {@code limit}.
     */
    public StoreController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.storeService = registry.get(StoreService.class);
        this.defaultLimit = options.hasPath("default-limit") ? options.getInt("default-limit") : null;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.post(path(basePath, "list/store"), this::listStores);
        app.post(path(basePath, "list/drink"), this::listDrinks);
        app.post(path(basePath, "list/drink/simplified"), this::listSimplifiedDrinks);
        app.get(path(basePath, "list/company"),
            ctx -> ctx.status(HttpStatus.OK).json(DataResponseDto.of(storeService.listCompanies())));
        app.get(path(basePath, "list/brand"),
            ctx -> ctx.status(HttpStatus.OK).json(DataResponseDto.of(storeService.listBrands())));
        app.get(path(basePath, "list/drink_tag"),
            ctx -> ctx.status(HttpStatus.OK).json(DataResponseDto.of(storeService.listDrinkTags())));
    }

    void listStores(final Context ctx) {
        final DrinkSearchRequest request = ctx.bodyAsClass(DrinkSearchRequest.class);
        ctx.status(HttpStatus.OK).json(DataResponseDto.of(storeService.listStores(request)));
    }

    void listDrinks(final Context ctx) {
        final DrinkSearchRequest request = ctx.bodyAsClass(DrinkSearchRequest.class);
        ctx.status(HttpStatus.OK).json(DataResponseDto.of(storeService.listDrinks(request, limit(ctx))));
    }

    void listSimplifiedDrinks(final Context ctx) {
        final DrinkSearchRequest request = ctx.bodyAsClass(DrinkSearchRequest.class);
        ctx.status(HttpStatus.OK).json(DataResponseDto.of(storeService.listSimplifiedDrinks(request, limit(ctx))));
    }

    private Integer limit(final Context ctx) {
        final String raw = ctx.queryParam("limit");
        if (raw == null || raw.isBlank()) {
            return defaultLimit;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer, got '" + raw + "'");
        }
    }
}
