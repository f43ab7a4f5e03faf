package org.subtrack.global.db;

import java.util.function.Supplier;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.r2dbc.dialect.R2dbcDialect;
import org.springframework.data.relational.core.dialect.RenderContextFactory;
import org.springframework.data.relational.core.sql.BindMarker;
import org.springframework.data.relational.core.sql.Delete;
import org.springframework.data.relational.core.sql.SQL;
import org.springframework.data.relational.core.sql.Select;
import org.springframework.data.relational.core.sql.Update;
import org.springframework.data.relational.core.sql.render.SqlRenderer;
import org.springframework.r2dbc.core.PreparedOperation;
import org.springframework.r2dbc.core.binding.BindTarget;
import org.springframework.r2dbc.core.binding.Bindings;
import org.springframework.r2dbc.core.binding.MutableBindings;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DbUtils {

	public static PreparedOperation<Select> select(Select select, Bindings bindings, R2dbcEntityTemplate r2dbc) {
		return preparedOperation(select, bindings, () -> getRenderer(r2dbc).render(select));
	}

	public static PreparedOperation<Delete> delete(Delete delete, Bindings bindings, R2dbcEntityTemplate r2dbc) {
		return preparedOperation(delete, bindings, () -> getRenderer(r2dbc).render(delete));
	}

	public static PreparedOperation<Update> update(Update update, Bindings bindings, R2dbcEntityTemplate r2dbc) {
		return preparedOperation(update, bindings, () -> getRenderer(r2dbc).render(update));
	}
	
	public static MutableBindings bindings(R2dbcEntityTemplate r2dbc) {
		return new MutableBindings(getDialect(r2dbc).getBindMarkersFactory().create());
	}
	
	/** Binds the given value and returns the marker to use in the statement. */
	public static BindMarker bind(MutableBindings bindings, Object value) {
		return SQL.bindMarker(bindings.bind(value).getPlaceholder());
	}
	
	private static <T> PreparedOperation<T> preparedOperation(T source, Bindings bindings, Supplier<String> toQuery) {
		return new PreparedOperation<T>() {
			@Override
			public void bindTo(BindTarget target) {
				if (bindings != null)
					bindings.apply(target);
			}
			
			@Override
			public T getSource() {
				return source;
			}
			
			@Override
			public String toQuery() {
				return toQuery.get();
			}
		};
	}
	
	private static R2dbcDialect getDialect(R2dbcEntityTemplate r2dbc) {
		return DialectResolver.getDialect(r2dbc.getDatabaseClient().getConnectionFactory());
	}
	
	private static SqlRenderer getRenderer(R2dbcEntityTemplate r2dbc) {
		return SqlRenderer.create(new RenderContextFactory(getDialect(r2dbc)).createRenderContext());
	}
	
}
